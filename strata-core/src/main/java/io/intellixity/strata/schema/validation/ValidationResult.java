package io.intellixity.strata.schema.validation;

import io.intellixity.strata.error.ValidationException;

/** Outcome of a validation pass: valid, or the first error found. */
public record ValidationResult(boolean valid, String error) {
  private static final ValidationResult OK = new ValidationResult(true, null);

  public static ValidationResult ok() { return OK; }

  public static ValidationResult fail(String error) {
    return new ValidationResult(false, error);
  }

  /** Returns normally when valid; otherwise throws {@link ValidationException} carrying {@link #error()}. */
  public void orThrow() {
    if (!valid) throw new ValidationException(error);
  }
}
