package io.intellixity.polystore.persistence.adapter;

import io.intellixity.polystore.persistence.exec.AggregateResult;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.update.UpdateExpression;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Backend-specific execution path behind {@link DialectAdapter}; arguments are already decoded. */
interface Route {
  Object create(String collection, Map<String, Object> document);

  Optional<Map<String, Object>> get(String collection, Filter filter);

  List<Map<String, Object>> getMany(String collection, Filter filter, List<SortField> sort, Page page);

  boolean update(String collection, Filter filter, UpdateExpression update);

  boolean delete(String collection, Filter filter);

  long count(String collection, Filter filter);

  AggregateResult aggregate(String collection, List<Map<String, Object>> pipeline);
}
