package io.intellixity.strata.error;

/** Underlying storage open/read/write failure. Never retried by the routing layer. */
public final class StorageException extends StrataException {
  public StorageException(String message, Throwable cause) {
    super(ErrorKind.IO, message, cause);
  }

  public StorageException(String message) {
    super(ErrorKind.IO, message);
  }
}
