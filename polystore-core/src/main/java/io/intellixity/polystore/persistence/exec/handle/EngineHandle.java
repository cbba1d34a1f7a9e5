package io.intellixity.polystore.persistence.exec.handle;

import io.intellixity.polystore.persistence.exec.Backend;

/**
 * Ready, authenticated handle to one backend, supplied by an {@link EngineHandleResolver}.
 * <p>
 * Every handle states who owns its lifecycle:
 * <ul>
 *   <li>{@link ClosableHandle}: owned by the store, closed on {@code disconnect()}</li>
 *   <li>{@link ExternallyManagedHandle}: owned by whoever provisioned it, left open</li>
 * </ul>
 * Examples: JDBC {@code client()} is a {@code javax.sql.DataSource} and {@code namespace()} a schema;
 * Mongo {@code client()} is a {@code MongoClient} and {@code namespace()} a database.
 */
public sealed interface EngineHandle<TClient> permits ClosableHandle, ExternallyManagedHandle {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  Backend backend();

  /** Native client used by an engine (DataSource, MongoClient, etc.). */
  TClient client();

  /** Namespace (schema/database) for this handle; may be null where the backend has a default. */
  String namespace();
}
