package io.intellixity.polystore.persistence.exec.handle;

import io.intellixity.polystore.persistence.config.PersistenceSettings;
import io.intellixity.polystore.persistence.exec.Backend;

/**
 * Application-implemented connection lifecycle: maps the selected backend and its settings to a
 * ready {@link EngineHandle}. Called once per store, from {@code connect()}.
 */
@FunctionalInterface
public interface EngineHandleResolver {
  EngineHandle<?> resolve(Backend backend, PersistenceSettings settings);
}
