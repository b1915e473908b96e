package io.intellixity.strata.routing;

import java.util.List;

/**
 * Statement surface bound to one database (and, inside a transaction, to one connection).\n
 *
 * All values are passed as bound parameters, never concatenated into SQL.\n
 */
public interface SqlExecutor {
  DatabaseTarget target();

  List<Row> query(String sql, Object... params);

  /** First row or null. */
  Row queryOne(String sql, Object... params);

  ExecuteResult execute(String sql, Object... params);
}
