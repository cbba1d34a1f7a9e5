package io.intellixity.polystore.persistence.update;

import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;

import java.util.*;

/**
 * Partial update: either a flat {@code field -> value} map, or the same map wrapped in the
 * {@value #SET} operator. Both forms mean "overwrite these fields".
 */
public sealed interface UpdateExpression permits UpdateExpression.Fields, UpdateExpression.SetFields {
  String SET = "$set";

  /** Fields to overwrite, in caller order. */
  Map<String, Object> values();

  /** Document-style rendering of this expression. */
  Map<String, Object> toNative();

  record Fields(Map<String, Object> values) implements UpdateExpression {
    public Fields {
      values = copy(values);
    }

    @Override public Map<String, Object> toNative() { return new LinkedHashMap<>(values); }
  }

  record SetFields(Map<String, Object> values) implements UpdateExpression {
    public SetFields {
      values = copy(values);
    }

    @Override public Map<String, Object> toNative() {
      Map<String, Object> out = new LinkedHashMap<>();
      out.put(SET, new LinkedHashMap<>(values));
      return out;
    }
  }

  static UpdateExpression fields(Map<String, ?> values) { return new Fields(copy(values)); }

  static UpdateExpression set(Map<String, ?> values) { return new SetFields(copy(values)); }

  /**
   * Decodes a document-style update. {@code {"$set": {...}}} becomes {@link SetFields}; a map without
   * operator keys becomes {@link Fields}. Other operators, or {@code $set} next to plain fields,
   * are rejected.
   */
  static UpdateExpression decode(Map<String, ?> raw) {
    Objects.requireNonNull(raw, "update");
    List<String> operators = new ArrayList<>();
    for (String k : raw.keySet()) {
      if (k != null && k.startsWith("$")) operators.add(k);
    }
    if (operators.isEmpty()) return fields(raw);

    if (!operators.equals(List.of(SET))) {
      throw new TranslationAmbiguityException(
          "Unsupported update operator(s) " + operators + " (only " + SET + " is recognized)");
    }
    if (raw.size() != 1) {
      throw new TranslationAmbiguityException("Update mixes " + SET + " with plain fields: " + raw.keySet());
    }
    Object inner = raw.get(SET);
    if (!(inner instanceof Map<?, ?> m)) {
      throw new TranslationAmbiguityException(SET + " expects an object, got " + (inner == null ? "null" : inner.getClass().getSimpleName()));
    }
    Map<String, Object> values = new LinkedHashMap<>();
    for (var e : m.entrySet()) {
      if (!(e.getKey() instanceof String k)) {
        throw new TranslationAmbiguityException(SET + " has a non-string field name: " + e.getKey());
      }
      if (k.startsWith("$")) throw new TranslationAmbiguityException("Nested operator " + k + " inside " + SET);
      values.put(k, e.getValue());
    }
    return new SetFields(values);
  }

  private static Map<String, Object> copy(Map<String, ?> values) {
    Objects.requireNonNull(values, "values");
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
