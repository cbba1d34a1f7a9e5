package io.intellixity.polystore.persistence.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of {@link DocumentStore#aggregate}.
 * <p>
 * Aggregation pipelines only run on the document backend. Against the relational backend the
 * store answers {@link NotSupported}, whose {@link #documents()} is empty, so callers that only
 * read documents see an empty sequence while callers that care can tell the two apart.
 */
public sealed interface AggregateResult permits AggregateResult.Documents, AggregateResult.NotSupported {

  List<Map<String, Object>> documents();

  boolean supported();

  static AggregateResult of(List<Map<String, Object>> documents) {
    return new Documents(documents);
  }

  static AggregateResult notSupported(Backend backend, String reason) {
    return new NotSupported(backend, reason);
  }

  record Documents(List<Map<String, Object>> documents) implements AggregateResult {
    public Documents {
      documents = (documents == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(documents));
    }

    @Override public boolean supported() { return true; }
  }

  record NotSupported(Backend backend, String reason) implements AggregateResult {
    public NotSupported {
      Objects.requireNonNull(backend, "backend");
      reason = (reason == null) ? "aggregation is not supported" : reason;
    }

    @Override public List<Map<String, Object>> documents() { return List.of(); }
    @Override public boolean supported() { return false; }
  }
}
