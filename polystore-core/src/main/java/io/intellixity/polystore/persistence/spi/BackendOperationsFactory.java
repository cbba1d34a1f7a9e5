package io.intellixity.polystore.persistence.spi;

import io.intellixity.polystore.persistence.exec.Backend;
import io.intellixity.polystore.persistence.exec.handle.EngineHandle;

@FunctionalInterface
public interface BackendOperationsFactory {
  BackendOperations create(Backend backend, EngineHandle<?> handle);
}
