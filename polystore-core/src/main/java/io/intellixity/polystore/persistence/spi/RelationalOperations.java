package io.intellixity.polystore.persistence.spi;

import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.translate.ColumnPredicate;
import io.intellixity.polystore.persistence.translate.OrderBy;
import io.intellixity.polystore.persistence.translate.RowWindow;

import java.util.List;
import java.util.Map;

/**
 * Table/row operations. {@code where} lists are ANDed; an empty list constrains nothing.
 * Rows come back keyed by column name.
 */
public non-sealed interface RelationalOperations extends BackendOperations {

  @Override
  default Backend backend() { return Backend.JDBC; }

  /** Inserts one row and returns its primary key. */
  Object insert(String table, Map<String, Object> row);

  /** {@code order} may be null. */
  List<Map<String, Object>> select(String table, List<ColumnPredicate> where, OrderBy order, RowWindow window);

  int update(String table, List<ColumnPredicate> where, Map<String, Object> values);

  int delete(String table, List<ColumnPredicate> where);

  long count(String table, List<ColumnPredicate> where);

  /** Round-trip used to validate the handle at connect time. */
  void ping();
}
