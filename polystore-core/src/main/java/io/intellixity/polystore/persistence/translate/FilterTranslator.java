package io.intellixity.polystore.persistence.translate;

import io.intellixity.polystore.persistence.exceptions.TranslationAmbiguityException;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.FilterValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link Filter} into backend-native constraints in a single pass.
 * <ul>
 *   <li>relational: one {@link ColumnPredicate} per field, in filter order</li>
 *   <li>document: the equivalent document-style map ({@code $in} kept as-is)</li>
 * </ul>
 */
public final class FilterTranslator {

  public List<ColumnPredicate> toPredicates(Filter filter) {
    if (filter == null || filter.isEmpty()) return List.of();
    List<ColumnPredicate> out = new ArrayList<>(filter.fields().size());
    for (var e : filter.fields().entrySet()) {
      String column = e.getKey();
      FilterValue v = e.getValue();
      if (v instanceof FilterValue.In in) {
        out.add(new ColumnPredicate.Member(column, in.values()));
      } else {
        Object literal = ((FilterValue.Eq) v).value();
        if (literal instanceof Map<?, ?>) {
          throw new TranslationAmbiguityException(
              "Nested document equality on '" + column + "' has no column equivalent");
        }
        out.add(new ColumnPredicate.Equal(column, literal));
      }
    }
    return List.copyOf(out);
  }

  public Map<String, Object> toDocument(Filter filter) {
    return (filter == null) ? Map.of() : filter.toNative();
  }
}
