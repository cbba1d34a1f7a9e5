package io.intellixity.polystore.persistence.jdbc;

import io.intellixity.polystore.persistence.exceptions.BackendException;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.handle.ClosableHandle;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * JDBC-family engine handle (resolved by application code). The store owns it: {@link #close()}
 * shuts the pool down when the data source supports it.
 */
public final class JdbcHandle implements ClosableHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String schema;

  public JdbcHandle(String id, DataSource client, String schema) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
  }

  @Override public String id() { return id; }
  @Override public Backend backend() { return Backend.JDBC; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }

  @Override
  public void close() {
    if (!(client instanceof AutoCloseable c)) return;
    try {
      c.close();
    } catch (Exception e) {
      throw new BackendException(Backend.JDBC, "CLOSE", id, e);
    }
  }

  @Override
  public String toString() {
    return "JdbcHandle[id=" + id + ", schema=" + schema + "]";
  }
}
