package io.intellixity.strata.routing;

/** Callback run inside {@link QueryRouter#transaction}. */
@FunctionalInterface
public interface TxWork<T> {
  T run(SqlExecutor tx);
}
