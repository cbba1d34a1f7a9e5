package io.intellixity.polystore.persistence.query;

import java.util.*;

/**
 * Conjunction of per-field constraints. Insertion order is kept so translated predicates come out
 * in the order the caller wrote them.
 * <p>
 * There is no OR / NOT: a filter is always {@code f1 AND f2 AND ...}.
 */
public record Filter(Map<String, FilterValue> fields) {
  private static final Filter EMPTY = new Filter(Map.of());

  public Filter {
    Objects.requireNonNull(fields, "fields");
    Map<String, FilterValue> copy = new LinkedHashMap<>();
    for (var e : fields.entrySet()) {
      copy.put(Objects.requireNonNull(e.getKey(), "field"), Objects.requireNonNull(e.getValue(), "value"));
    }
    fields = Collections.unmodifiableMap(copy);
  }

  public static Filter empty() { return EMPTY; }

  /** Decodes a document-style filter map. {@code null} decodes to the empty filter. */
  public static Filter decode(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) return EMPTY;
    Map<String, FilterValue> out = new LinkedHashMap<>();
    for (var e : raw.entrySet()) {
      out.put(e.getKey(), FilterValue.decode(e.getKey(), e.getValue()));
    }
    return new Filter(out);
  }

  public static Filter eq(String field, Object value) {
    return builder().eq(field, value).build();
  }

  public static Builder builder() { return new Builder(); }

  public boolean isEmpty() { return fields.isEmpty(); }

  public boolean has(String field) { return fields.containsKey(field); }

  public FilterValue get(String field) { return fields.get(field); }

  /** Document-style rendering, e.g. {@code {a: 1, b: {$in: [2, 3]}}}. */
  public Map<String, Object> toNative() {
    Map<String, Object> out = new LinkedHashMap<>();
    fields.forEach((k, v) -> out.put(k, v.toNative()));
    return out;
  }

  public static final class Builder {
    private final Map<String, FilterValue> fields = new LinkedHashMap<>();

    private Builder() {}

    public Builder eq(String field, Object value) {
      fields.put(Objects.requireNonNull(field, "field"), FilterValue.eq(value));
      return this;
    }

    public Builder in(String field, Collection<?> values) {
      fields.put(Objects.requireNonNull(field, "field"), FilterValue.in(Objects.requireNonNull(values, "values")));
      return this;
    }

    public Filter build() {
      return fields.isEmpty() ? EMPTY : new Filter(fields);
    }
  }
}
