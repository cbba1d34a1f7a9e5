package io.intellixity.polystore.persistence.translate;

import java.util.Objects;

/** Single ordering key for the relational backend. */
public record OrderBy(String column, boolean descending) {
  public OrderBy {
    Objects.requireNonNull(column, "column");
  }
}
