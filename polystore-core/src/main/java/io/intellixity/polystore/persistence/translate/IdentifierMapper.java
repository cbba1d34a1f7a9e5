package io.intellixity.polystore.persistence.translate;

import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.FilterValue;

import java.util.*;

/**
 * Maps between the caller-facing identifier key ({@value #CANONICAL_ID}) and a backend's native
 * primary-key field.
 * <p>
 * Both directions are idempotent and never mutate their input.
 */
public final class IdentifierMapper {
  public static final String CANONICAL_ID = "_id";
  public static final String RELATIONAL_ID = "id";

  private static final IdentifierMapper DOCUMENT = new IdentifierMapper(CANONICAL_ID, CANONICAL_ID);
  private static final IdentifierMapper RELATIONAL = new IdentifierMapper(CANONICAL_ID, RELATIONAL_ID);

  private final String canonicalKey;
  private final String nativeKey;

  public IdentifierMapper(String canonicalKey, String nativeKey) {
    this.canonicalKey = Objects.requireNonNull(canonicalKey, "canonicalKey");
    this.nativeKey = Objects.requireNonNull(nativeKey, "nativeKey");
  }

  /** Document store: the native key already is the canonical one. */
  public static IdentifierMapper document() { return DOCUMENT; }

  /** Relational store: {@code _id <-> id}. */
  public static IdentifierMapper relational() { return RELATIONAL; }

  public String canonicalKey() { return canonicalKey; }
  public String nativeKey() { return nativeKey; }

  public boolean isIdentity() { return canonicalKey.equals(nativeKey); }

  /** Native name for a single field (used for sort keys). */
  public String toNativeField(String field) {
    return canonicalKey.equals(field) ? nativeKey : field;
  }

  /**
   * Renames the canonical identifier in a filter to the native key, keeping its position.
   * A filter that names both keys with the same constraint collapses to one entry; different
   * constraints are ambiguous.
   */
  public Filter toNative(Filter filter) {
    if (filter == null) return Filter.empty();
    if (isIdentity() || !filter.has(canonicalKey)) return filter;

    FilterValue canonical = filter.get(canonicalKey);
    FilterValue existing = filter.get(nativeKey);
    if (existing != null && !existing.equals(canonical)) {
      throw new TranslationAmbiguityException(
          "Filter names both '" + canonicalKey + "' and '" + nativeKey + "' with different values");
    }

    Map<String, FilterValue> out = new LinkedHashMap<>();
    for (var e : filter.fields().entrySet()) {
      String k = e.getKey();
      if (k.equals(nativeKey)) continue;
      out.put(k.equals(canonicalKey) ? nativeKey : k, e.getValue());
    }
    return new Filter(out);
  }

  /** Same renaming for a document about to be written. */
  public Map<String, Object> toNativeDocument(Map<String, ?> document) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (document == null) return out;
    if (isIdentity() || !document.containsKey(canonicalKey)) {
      out.putAll(document);
      return out;
    }
    Object canonical = document.get(canonicalKey);
    if (document.containsKey(nativeKey) && !Objects.equals(document.get(nativeKey), canonical)) {
      throw new TranslationAmbiguityException(
          "Document names both '" + canonicalKey + "' and '" + nativeKey + "' with different values");
    }
    for (var e : document.entrySet()) {
      String k = e.getKey();
      if (k.equals(nativeKey)) continue;
      out.put(k.equals(canonicalKey) ? nativeKey : k, e.getValue());
    }
    return out;
  }

  /** Adds the canonical key next to the native one when only the native key is present. */
  public Map<String, Object> toCanonical(Map<String, ?> document) {
    if (document == null) return null;
    Map<String, Object> out = new LinkedHashMap<>(document);
    if (!isIdentity() && out.containsKey(nativeKey) && !out.containsKey(canonicalKey)) {
      out.put(canonicalKey, out.get(nativeKey));
    }
    return out;
  }
}
