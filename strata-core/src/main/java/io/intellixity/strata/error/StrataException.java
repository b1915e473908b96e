package io.intellixity.strata.error;

import java.util.Objects;

/**
 * Base unchecked error for the routing, schema and repair layers.\n
 *
 * Every instance carries an {@link ErrorKind}; subclasses exist so callers can catch a single class.\n
 */
public class StrataException extends RuntimeException {
  private final ErrorKind kind;

  public StrataException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public StrataException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() { return kind; }
}
