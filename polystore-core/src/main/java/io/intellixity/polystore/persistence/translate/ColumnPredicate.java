package io.intellixity.polystore.persistence.translate;

import java.util.*;

/** One relational constraint produced by {@link FilterTranslator}; a list of them is ANDed. */
public sealed interface ColumnPredicate permits ColumnPredicate.Equal, ColumnPredicate.Member {
  String column();

  /** {@code column = value}, or {@code column IS NULL} when value is null. */
  record Equal(String column, Object value) implements ColumnPredicate {
    public Equal {
      Objects.requireNonNull(column, "column");
    }
  }

  /** {@code column IN (values...)}. An empty set matches nothing. */
  record Member(String column, List<Object> values) implements ColumnPredicate {
    public Member {
      Objects.requireNonNull(column, "column");
      values = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values, "values")));
    }
  }
}
