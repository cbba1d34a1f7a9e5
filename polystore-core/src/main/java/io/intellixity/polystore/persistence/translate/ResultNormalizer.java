package io.intellixity.polystore.persistence.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Reshapes backend results into canonical documents. Order is preserved; nothing is deduplicated. */
public final class ResultNormalizer {
  private final IdentifierMapper ids;

  public ResultNormalizer(IdentifierMapper ids) {
    this.ids = Objects.requireNonNull(ids, "ids");
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> normalizeOne(Map<String, ?> row) {
    if (row == null) return null;
    if (ids.isIdentity()) return (Map<String, Object>) row;
    return ids.toCanonical(row);
  }

  public List<Map<String, Object>> normalizeMany(List<? extends Map<String, ?>> rows) {
    if (rows == null || rows.isEmpty()) return List.of();
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, ?> r : rows) out.add(normalizeOne(r));
    return out;
  }
}
