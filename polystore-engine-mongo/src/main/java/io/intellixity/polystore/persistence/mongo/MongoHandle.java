package io.intellixity.polystore.persistence.mongo;

import com.mongodb.client.MongoClient;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.handle.ExternallyManagedHandle;

import java.util.Objects;

/**
 * Mongo engine handle (resolved by application code). The client belongs to whoever created it;
 * stores never close it.
 */
public final class MongoHandle implements ExternallyManagedHandle<MongoClient> {
  private final String id;
  private final MongoClient client;
  private final String database;

  public MongoHandle(String id, MongoClient client, String database) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.database = Objects.requireNonNull(database, "database");
  }

  @Override public String id() { return id; }
  @Override public Backend backend() { return Backend.MONGO; }
  @Override public MongoClient client() { return client; }
  @Override public String namespace() { return database; }

  public String database() { return database; }

  @Override
  public String toString() {
    return "MongoHandle[id=" + id + ", database=" + database + "]";
  }
}
