package io.intellixity.polystore.persistence.jdbc;

import io.intellixity.polystore.persistence.exceptions.BackendException;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.spi.RelationalOperations;
import io.intellixity.polystore.persistence.translate.ColumnPredicate;
import io.intellixity.polystore.persistence.translate.IdentifierMapper;
import io.intellixity.polystore.persistence.translate.OrderBy;
import io.intellixity.polystore.persistence.translate.RowWindow;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Query;
import org.jooq.Record;
import org.jooq.Record1;
import org.jooq.SQLDialect;
import org.jooq.SelectQuery;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import static org.jooq.impl.DSL.field;
import static org.jooq.impl.DSL.name;
import static org.jooq.impl.DSL.table;

/**
 * Relational operations built with jOOQ over the handle's {@code DataSource}. Every statement is
 * rendered with bind values; identifiers are quoted, so table and column names are case-sensitive.
 * <p>
 * Update and delete affect every matching row.
 */
public final class JooqRelationalOperations implements RelationalOperations {
  private static final Logger log = LoggerFactory.getLogger(JooqRelationalOperations.class);

  private final JdbcHandle handle;
  private final DSLContext ctx;
  private final String idColumn;

  public JooqRelationalOperations(JdbcHandle handle, SQLDialect dialect, String idColumn) {
    this.handle = Objects.requireNonNull(handle, "handle");
    this.ctx = DSL.using(handle.client(), Objects.requireNonNull(dialect, "dialect"));
    this.idColumn = Objects.requireNonNull(idColumn, "idColumn");
  }

  public JooqRelationalOperations(JdbcHandle handle, SQLDialect dialect) {
    this(handle, dialect, IdentifierMapper.RELATIONAL_ID);
  }

  @Override
  public Object insert(String table, Map<String, Object> row) {
    Table<?> t = tableOf(table);
    Field<Object> id = field(name(idColumn));
    var insert = (row == null || row.isEmpty())
        ? ctx.insertInto(t).defaultValues().returningResult(id)
        : ctx.insertInto(t).set(fieldsOf(row)).returningResult(id);
    return run("INSERT", table, insert, () -> {
      Record1<Object> r = insert.fetchOne();
      return (r == null) ? null : r.value1();
    });
  }

  @Override
  public List<Map<String, Object>> select(String table, List<ColumnPredicate> where, OrderBy order, RowWindow window) {
    SelectQuery<Record> q = ctx.selectQuery();
    q.addFrom(tableOf(table));
    q.addConditions(conditions(where));
    if (order != null) {
      Field<Object> f = field(name(order.column()));
      q.addOrderBy(order.descending() ? f.desc() : f.asc());
    }
    if (window != null && window.bounded()) {
      if (window.offset() > 0) q.addLimit(window.offset(), window.limit());
      else q.addLimit(window.limit());
    }
    return run("SELECT", table, q, q::fetchMaps);
  }

  @Override
  public int update(String table, List<ColumnPredicate> where, Map<String, Object> values) {
    if (values == null || values.isEmpty()) throw new IllegalArgumentException("values must not be empty");
    var update = ctx.update(tableOf(table)).set(fieldsOf(values)).where(conditions(where));
    return run("UPDATE", table, update, update::execute);
  }

  @Override
  public int delete(String table, List<ColumnPredicate> where) {
    var delete = ctx.deleteFrom(tableOf(table)).where(conditions(where));
    return run("DELETE", table, delete, delete::execute);
  }

  @Override
  public long count(String table, List<ColumnPredicate> where) {
    var count = ctx.selectCount().from(tableOf(table)).where(conditions(where));
    return run("COUNT", table, count, () -> {
      Long n = count.fetchOne(0, Long.class);
      return (n == null) ? 0L : n;
    });
  }

  @Override
  public void ping() {
    var q = ctx.selectOne();
    run("PING", null, q, q::fetch);
  }

  /** Predicates ANDed in order; a null value becomes {@code IS NULL}. */
  static List<Condition> conditions(List<ColumnPredicate> where) {
    List<Condition> out = new ArrayList<>();
    if (where == null) return out;
    for (ColumnPredicate p : where) {
      Field<Object> f = field(name(p.column()));
      if (p instanceof ColumnPredicate.Member m) {
        out.add(m.values().isEmpty() ? DSL.falseCondition() : f.in(m.values()));
      } else {
        Object v = ((ColumnPredicate.Equal) p).value();
        out.add(v == null ? f.isNull() : f.eq(v));
      }
    }
    return out;
  }

  private Table<?> tableOf(String table) {
    Objects.requireNonNull(table, "table");
    return (handle.schema() == null) ? table(name(table)) : table(name(handle.schema(), table));
  }

  private static Map<Field<?>, Object> fieldsOf(Map<String, Object> row) {
    Map<Field<?>, Object> out = new LinkedHashMap<>();
    row.forEach((k, v) -> out.put(field(name(k)), v));
    return out;
  }

  private <T> T run(String op, String table, Query query, Supplier<T> action) {
    long start = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug("polystore.jdbc op={} handleId={} schema={} table={} sql={}",
          op, handle.id(), handle.schema(), table, query.getSQL());
    }
    try {
      T result = action.get();
      if (log.isDebugEnabled()) {
        log.debug("polystore.jdbc_done op={} durationMs={} result={}",
            op, (System.nanoTime() - start) / 1_000_000.0, summarize(result));
      }
      return result;
    } catch (DataAccessException e) {
      log.debug("polystore.jdbc_failed op={} table={} error={}", op, table, e.toString());
      throw new BackendException(Backend.JDBC, op, table, e);
    }
  }

  private static Object summarize(Object result) {
    if (result instanceof List<?> l) return "rows=" + l.size();
    return result;
  }
}
