package io.intellixity.polystore.persistence.exceptions;

import io.intellixity.polystore.persistence.exec.Backend;

import java.util.Objects;

/** Failure surfaced by the underlying document or relational client, with backend context attached. */
public final class BackendException extends PolystoreException {
  private final Backend backend;
  private final String operation;
  private final String collection;

  public BackendException(Backend backend, String operation, String collection, Throwable cause) {
    super(describe(backend, operation, collection) + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
    this.backend = Objects.requireNonNull(backend, "backend");
    this.operation = operation;
    this.collection = collection;
  }

  public BackendException(Backend backend, String operation, String collection, String message) {
    super(describe(backend, operation, collection) + ": " + message);
    this.backend = Objects.requireNonNull(backend, "backend");
    this.operation = operation;
    this.collection = collection;
  }

  public Backend backend() { return backend; }
  public String operation() { return operation; }
  public String collection() { return collection; }

  private static String describe(Backend backend, String operation, String collection) {
    return backend + " " + operation + " on '" + collection + "' failed";
  }
}
