package io.intellixity.polystore.persistence.spi;

import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Document-store operations. Filters and updates arrive in the store's own document shape
 * ({@code $in}, {@code $set}); results are returned as the driver produced them.
 */
public non-sealed interface DocumentOperations extends BackendOperations {

  @Override
  default Backend backend() { return Backend.MONGO; }

  Object insertOne(String collection, Map<String, Object> document);

  Optional<Map<String, Object>> findOne(String collection, Map<String, Object> filter);

  List<Map<String, Object>> find(String collection, Map<String, Object> filter, List<SortField> sort, Page page);

  /** Returns true when a document matched. */
  boolean updateOne(String collection, Map<String, Object> filter, Map<String, Object> update);

  boolean deleteOne(String collection, Map<String, Object> filter);

  long count(String collection, Map<String, Object> filter);

  List<Map<String, Object>> aggregate(String collection, List<Map<String, Object>> pipeline);
}
