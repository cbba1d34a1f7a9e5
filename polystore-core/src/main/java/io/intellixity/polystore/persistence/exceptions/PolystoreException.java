package io.intellixity.polystore.persistence.exceptions;

/** Root of all failures raised by the persistence layer. */
public class PolystoreException extends RuntimeException {
  public PolystoreException(String message) {
    super(message);
  }

  public PolystoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
