package io.intellixity.strata.error;

/** A document, schema or identifier failed shape/type constraints. Nothing was written. */
public final class ValidationException extends StrataException {
  public ValidationException(String message) {
    super(ErrorKind.VALIDATION, message);
  }
}
