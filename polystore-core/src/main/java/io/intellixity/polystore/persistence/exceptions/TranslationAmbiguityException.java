package io.intellixity.polystore.persistence.exceptions;

/**
 * Raised when a filter operator, sort specification or update expression has a shape
 * the translators do not recognize.
 * <p>
 * Unknown shapes are rejected while decoding caller arguments, before anything reaches a backend.
 */
public final class TranslationAmbiguityException extends PolystoreException {
  public TranslationAmbiguityException(String message) {
    super(message);
  }
}
