package io.intellixity.polystore.persistence.query;

import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;

import java.util.*;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public boolean descending() { return direction == Direction.DESC; }

  public enum Direction {
    ASC(1),
    DESC(-1);

    private final int code;

    Direction(int code) {
      this.code = code;
    }

    /** Document-store direction code: 1 ascending, -1 descending. */
    public int code() { return code; }

    public static Direction fromCode(Object code) {
      if (code instanceof Direction d) return d;
      if (code instanceof Number n && n.doubleValue() == n.intValue()) {
        if (n.intValue() == 1) return ASC;
        if (n.intValue() == -1) return DESC;
      }
      if (code instanceof String s) {
        String v = s.trim().toUpperCase(Locale.ROOT);
        if (v.equals("ASC") || v.equals("1")) return ASC;
        if (v.equals("DESC") || v.equals("-1")) return DESC;
      }
      throw new TranslationAmbiguityException("Unrecognized sort direction: " + code);
    }
  }

  /**
   * Decodes one sort entry. Accepted shapes: a {@link SortField}, a bare field name (ascending),
   * a {@code (field, directionCode)} pair given as a two-element list/array or a {@link Map.Entry}.
   */
  public static SortField decode(Object raw) {
    if (raw instanceof SortField sf) return sf;
    if (raw instanceof String s) {
      if (s.isBlank()) throw new TranslationAmbiguityException("Sort field name is blank");
      return asc(s);
    }
    if (raw instanceof Map.Entry<?, ?> e) return pair(e.getKey(), e.getValue(), raw);
    if (raw instanceof List<?> l && l.size() == 2) return pair(l.get(0), l.get(1), raw);
    if (raw instanceof Object[] a && a.length == 2) return pair(a[0], a[1], raw);
    throw new TranslationAmbiguityException("Unrecognized sort specification: " + describe(raw));
  }

  /** Decodes an ordered sort specification; {@code null} decodes to no ordering. */
  public static List<SortField> decodeAll(List<?> raw) {
    if (raw == null || raw.isEmpty()) return List.of();
    List<SortField> out = new ArrayList<>(raw.size());
    for (Object o : raw) out.add(decode(o));
    return List.copyOf(out);
  }

  private static SortField pair(Object field, Object code, Object raw) {
    if (!(field instanceof String f) || f.isBlank()) {
      throw new TranslationAmbiguityException("Unrecognized sort specification: " + describe(raw));
    }
    return new SortField(f, Direction.fromCode(code));
  }

  private static String describe(Object raw) {
    if (raw instanceof Object[] a) return Arrays.toString(a);
    return String.valueOf(raw);
  }
}
