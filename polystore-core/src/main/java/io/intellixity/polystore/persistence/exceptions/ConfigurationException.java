package io.intellixity.polystore.persistence.exceptions;

/**
 * A setting required by the selected backend is missing or invalid.
 * <p>
 * Raised at startup (settings validation, {@code connect()}); never retried.
 */
public final class ConfigurationException extends PolystoreException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
