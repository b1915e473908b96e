package io.intellixity.strata.error;

import java.util.Objects;

/**
 * Duplicate name/token, or a delete blocked by dependent rows.\n
 *
 * {@link #code()} is stable and meant to be mapped to a 409-style response.\n
 */
public final class ConflictException extends StrataException {
  public static final String DUPLICATE_COLLECTION_NAME = "DUPLICATE_COLLECTION_NAME";
  public static final String COLLECTION_HAS_DOCUMENTS = "COLLECTION_HAS_DOCUMENTS";
  public static final String DUPLICATE_PROJECT_NAME = "DUPLICATE_PROJECT_NAME";
  public static final String DUPLICATE_API_KEY = "DUPLICATE_API_KEY";
  public static final String UNIQUE_CONSTRAINT = "UNIQUE_CONSTRAINT";

  private final String code;

  public ConflictException(String code, String message) {
    super(ErrorKind.CONFLICT, message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public ConflictException(String code, String message, Throwable cause) {
    super(ErrorKind.CONFLICT, message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  public String code() { return code; }
}
