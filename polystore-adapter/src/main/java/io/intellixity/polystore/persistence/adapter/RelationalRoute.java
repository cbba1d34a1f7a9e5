package io.intellixity.polystore.persistence.adapter;

import io.intellixity.polystore.persistence.exec.AggregateResult;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.query.Filter;
import io.intellixity.polystore.persistence.query.Page;
import io.intellixity.polystore.persistence.query.SortField;
import io.intellixity.polystore.persistence.spi.RelationalOperations;
import io.intellixity.polystore.persistence.translate.ColumnPredicate;
import io.intellixity.polystore.persistence.translate.FilterTranslator;
import io.intellixity.polystore.persistence.translate.IdentifierMapper;
import io.intellixity.polystore.persistence.translate.ResultNormalizer;
import io.intellixity.polystore.persistence.translate.RowWindow;
import io.intellixity.polystore.persistence.translate.SortPageTranslator;
import io.intellixity.polystore.persistence.translate.UpdateTranslator;
import io.intellixity.polystore.persistence.update.UpdateExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Relational backend: identifier mapping, then filter/sort/page/update translation, then the
 * table operations; rows come back through the result normalizer.
 */
final class RelationalRoute implements Route {
  private static final Logger log = LoggerFactory.getLogger(RelationalRoute.class);

  private final RelationalOperations ops;
  private final IdentifierMapper ids;
  private final FilterTranslator filters = new FilterTranslator();
  private final SortPageTranslator sortPage;
  private final UpdateTranslator updates;
  private final ResultNormalizer results;

  RelationalRoute(RelationalOperations ops, IdentifierMapper ids, Clock clock) {
    this.ops = Objects.requireNonNull(ops, "ops");
    this.ids = Objects.requireNonNull(ids, "ids");
    this.sortPage = new SortPageTranslator(ids);
    this.updates = new UpdateTranslator(clock);
    this.results = new ResultNormalizer(ids);
  }

  @Override
  public Object create(String collection, Map<String, Object> document) {
    return ops.insert(collection, updates.stampInsert(ids.toNativeDocument(document)));
  }

  @Override
  public Optional<Map<String, Object>> get(String collection, Filter filter) {
    List<Map<String, Object>> rows = ops.select(collection, where(filter), null, RowWindow.first(1));
    return rows.isEmpty() ? Optional.empty() : Optional.of(results.normalizeOne(rows.get(0)));
  }

  @Override
  public List<Map<String, Object>> getMany(String collection, Filter filter, List<SortField> sort, Page page) {
    List<Map<String, Object>> rows = ops.select(collection, where(filter), sortPage.order(sort).orElse(null), sortPage.window(page));
    return results.normalizeMany(rows);
  }

  @Override
  public boolean update(String collection, Filter filter, UpdateExpression update) {
    Map<String, Object> values = updates.toColumnUpdates(UpdateExpression.fields(ids.toNativeDocument(update.values())));
    return ops.update(collection, where(filter), values) > 0;
  }

  @Override
  public boolean delete(String collection, Filter filter) {
    return ops.delete(collection, where(filter)) > 0;
  }

  @Override
  public long count(String collection, Filter filter) {
    return ops.count(collection, where(filter));
  }

  @Override
  public AggregateResult aggregate(String collection, List<Map<String, Object>> pipeline) {
    log.warn("polystore.aggregate backend={} collection={} stages={}: aggregation pipelines are not supported, returning no documents",
        Backend.JDBC, collection, (pipeline == null) ? 0 : pipeline.size());
    return AggregateResult.notSupported(Backend.JDBC, "aggregation pipelines are not supported by the relational backend");
  }

  private List<ColumnPredicate> where(Filter filter) {
    return filters.toPredicates(ids.toNative(filter));
  }
}
