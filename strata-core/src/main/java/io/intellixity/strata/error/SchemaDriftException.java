package io.intellixity.strata.error;

/**
 * The live database is missing a table or column the code expects.\n
 *
 * This is the only error class that triggers automatic repair-and-retry.\n
 */
public final class SchemaDriftException extends StrataException {
  private final String missingObject;

  public SchemaDriftException(String message, String missingObject, Throwable cause) {
    super(ErrorKind.SCHEMA_DRIFT, message, cause);
    this.missingObject = missingObject;
  }

  /** Name of the missing table or column when it could be parsed from the driver message; may be null. */
  public String missingObject() { return missingObject; }
}
