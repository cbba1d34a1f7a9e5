package io.intellixity.polystore.persistence.query;

import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;

import java.util.*;

/**
 * Per-field constraint of a {@link Filter}: equality against a literal or membership in a set.
 * <p>
 * Decoded once from document-style values; any operator other than {@value #IN} is rejected.
 */
public sealed interface FilterValue permits FilterValue.Eq, FilterValue.In {
  String IN = "$in";

  /** Document-style rendering of this constraint. */
  Object toNative();

  record Eq(Object value) implements FilterValue {
    @Override public Object toNative() { return value; }
  }

  record In(List<Object> values) implements FilterValue {
    public In {
      Objects.requireNonNull(values, "values");
      values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override public Object toNative() {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put(IN, values);
      return m;
    }
  }

  static FilterValue eq(Object value) { return new Eq(value); }

  static FilterValue in(Collection<?> values) { return new In(new ArrayList<>(values)); }

  static FilterValue decode(String field, Object raw) {
    if (raw instanceof FilterValue fv) return fv;
    if (!(raw instanceof Map<?, ?> m)) return new Eq(raw);

    List<String> operators = new ArrayList<>();
    for (Object k : m.keySet()) {
      if (k instanceof String s && s.startsWith("$")) operators.add(s);
    }
    // plain nested document: equality against the whole value
    if (operators.isEmpty()) return new Eq(raw);

    if (m.size() == 1 && IN.equals(operators.get(0))) {
      return new In(toList(field, m.get(IN)));
    }
    if (operators.size() < m.size()) {
      throw new TranslationAmbiguityException(
          "Field '" + field + "' mixes operators " + operators + " with plain keys");
    }
    throw new TranslationAmbiguityException(
        "Unsupported filter operator(s) " + operators + " on field '" + field + "' (only " + IN + " is recognized)");
  }

  private static List<Object> toList(String field, Object v) {
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    if (v instanceof Object[] arr) return new ArrayList<>(Arrays.asList(arr));
    throw new TranslationAmbiguityException(
        IN + " on field '" + field + "' expects a collection, got " + (v == null ? "null" : v.getClass().getSimpleName()));
  }
}
