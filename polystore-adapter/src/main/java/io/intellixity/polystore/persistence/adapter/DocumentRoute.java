package io.intellixity.polystore.persistence.adapter;

import io.intellixity.polystore.persistence.exec.AggregateResult;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.spi.DocumentOperations;
import io.intellixity.polystore.persistence.translate.FilterTranslator;
import io.intellixity.polystore.persistence.update.UpdateExpression;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Document backend: the query model already is the native shape, results are returned as-is. */
final class DocumentRoute implements Route {
  private final DocumentOperations ops;
  private final FilterTranslator filters = new FilterTranslator();

  DocumentRoute(DocumentOperations ops) {
    this.ops = Objects.requireNonNull(ops, "ops");
  }

  @Override
  public Object create(String collection, Map<String, Object> document) {
    return ops.insertOne(collection, document);
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, Filter filter) {
    return ops.findOne(collection, filters.toDocument(filter));
  }

  @Override
  public List<Map<String, Object>> getMany(String collection, Filter filter, List<SortField> sort, Page page) {
    return ops.find(collection, filters.toDocument(filter), sort, page);
  }

  @Override
  public boolean update(String collection, Filter filter, UpdateExpression update) {
    return ops.updateOne(collection, filters.toDocument(filter), update.toNative());
  }

  @Override
  public boolean delete(String collection, Filter filter) {
    return ops.deleteOne(collection, filters.toDocument(filter));
  }

  @Override
  public long count(String collection, Filter filter) {
    return ops.count(collection, filters.toDocument(filter));
  }

  @Override
  public AggregateResult aggregate(String collection, List<Map<String, Object>> pipeline) {
    return AggregateResult.of(ops.aggregate(collection, (pipeline == null) ? List.of() : pipeline));
  }
}
