package io.intellixity.polystore.persistence.exec;

import io.intellixity.polystore.persistence.query.DocumentQuery;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.update.UpdateExpression;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend-agnostic document persistence API.
 * <p>
 * Documents are plain {@code Map<String, Object>} values whose identifier is always exposed under
 * {@code _id}, whichever backend is active. The map-taking overloads accept document-style
 * arguments ({@code {"status": {"$in": [...]}}}, {@code {"$set": {...}}}) and decode them once
 * before dispatch.
 */
public interface DocumentStore {

  /** Inserts a document and returns the identifier assigned by the backend (or supplied by the caller). */
  Object create(String collection, Map<String, ?> document);

  Optional<Map<String, Object>> get(String collection, Filter filter);

  List<Map<String, Object>> getMany(String collection, Filter filter, List<SortField> sort, Page page);

  /** Returns true when at least one record matched the filter. */
  boolean update(String collection, Filter filter, UpdateExpression update);

  /** Returns true when at least one record was removed. */
  boolean delete(String collection, Filter filter);

  long count(String collection, Filter filter);

  AggregateResult aggregate(String collection, List<Map<String, Object>> pipeline);

  // ---------- document-style overloads ----------

  default Optional<Map<String, Object>> get(String collection, Map<String, ?> filter) {
    return get(collection, Filter.decode(filter));
  }

  default List<Map<String, Object>> getMany(String collection, Filter filter) {
    return getMany(collection, filter, List.of(), Page.ALL);
  }

  default List<Map<String, Object>> getMany(String collection, Map<String, ?> filter, List<?> sort, Integer limit, int skip) {
    return getMany(collection, Filter.decode(filter), SortField.decodeAll(sort), Page.of(limit, skip));
  }

  default List<Map<String, Object>> getMany(String collection, DocumentQuery query) {
    DocumentQuery q = (query == null) ? DocumentQuery.all() : query;
    return getMany(collection, q.filter(), q.sort(), q.page());
  }

  default boolean update(String collection, Map<String, ?> filter, Map<String, ?> update) {
    return update(collection, Filter.decode(filter), UpdateExpression.decode(update));
  }

  default boolean delete(String collection, Map<String, ?> filter) {
    return delete(collection, Filter.decode(filter));
  }

  default long count(String collection) {
    return count(collection, Filter.empty());
  }

  default long count(String collection, Map<String, ?> filter) {
    return count(collection, Filter.decode(filter));
  }
}
