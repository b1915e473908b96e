package io.intellixity.strata.routing;

/** Result of a write: affected row count and the last inserted rowid (null when nothing was inserted). */
public record ExecuteResult(long changed, Long insertedId) {}
