package io.intellixity.strata.error;

/** A referenced project, collection, document or key does not exist. */
public final class NotFoundException extends StrataException {
  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }
}
