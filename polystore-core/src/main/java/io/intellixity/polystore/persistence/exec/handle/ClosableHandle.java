package io.intellixity.polystore.persistence.exec.handle;

/** Handle whose resources are released by the store that uses it. */
public non-sealed interface ClosableHandle<TClient> extends EngineHandle<TClient>, AutoCloseable {
  @Override
  void close();
}
