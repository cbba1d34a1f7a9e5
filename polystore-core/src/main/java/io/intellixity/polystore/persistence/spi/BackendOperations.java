package io.intellixity.polystore.persistence.spi;

import io.intellixity.polystore.persistence.exec.Backend;

/** Native operation set of one backend. Exactly one of the two families is implemented per engine. */
public sealed interface BackendOperations permits DocumentOperations, RelationalOperations {
  Backend backend();
}
