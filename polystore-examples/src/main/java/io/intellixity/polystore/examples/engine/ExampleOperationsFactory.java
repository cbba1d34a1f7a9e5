package io.intellixity.polystore.examples.engine;

import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.handle.EngineHandle;
import io.intellixity.polystore.persistence.jdbc.JdbcHandle;
import io.intellixity.polystore.persistence.jdbc.JooqDialects;
import io.intellixity.polystore.persistence.jdbc.JooqRelationalOperations;
import io.intellixity.polystore.persistence.mongo.MongoDocumentOperations;
import io.intellixity.polystore.persistence.mongo.MongoHandle;
import io.intellixity.polystore.persistence.spi.BackendOperations;
import io.intellixity.polystore.persistence.spi.BackendOperationsFactory;

import java.time.Clock;
import java.util.Objects;

public final class ExampleOperationsFactory implements BackendOperationsFactory {
  private final PersistenceSettings settings;
  private final Clock clock;

  public ExampleOperationsFactory(PersistenceSettings settings, Clock clock) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public BackendOperations create(Backend backend, EngineHandle<?> handle) {
    Objects.requireNonNull(handle, "handle");
    return switch (backend) {
      case MONGO -> new MongoDocumentOperations((MongoHandle) handle, clock);
      case JDBC -> new JooqRelationalOperations((JdbcHandle) handle,
          JooqDialects.resolve(settings.jdbcDialect(), settings.jdbcUrl()));
    };
  }
}
