package io.intellixity.strata.error;

/** Coarse error classes callers can branch on without inspecting messages. */
public enum ErrorKind {
  NOT_FOUND,
  VALIDATION,
  CONFLICT,
  SCHEMA_DRIFT,
  IO
}
