package io.intellixity.strata.routing;

import java.util.List;

/**
 * Single entry point for reads and writes against main or a project database.\n
 *
 * - Project targets are provisioned on first touch.\n
 * - Each call acquires a pooled connection and always releases it.\n
 * - {@link #transaction} runs every statement of the callback on one connection; commit on success,
 *   rollback and rethrow of the original error on failure.\n
 */
public interface QueryRouter {
  List<Row> query(DatabaseTarget target, String sql, Object... params);

  Row queryOne(DatabaseTarget target, String sql, Object... params);

  ExecuteResult execute(DatabaseTarget target, String sql, Object... params);

  <T> T transaction(DatabaseTarget target, TxWork<T> work);

  /** Runs a multi-statement script (DDL) outside any explicit transaction. */
  void executeScript(DatabaseTarget target, String script);

  default SqlExecutor on(DatabaseTarget target) {
    QueryRouter self = this;
    return new SqlExecutor() {
      @Override public DatabaseTarget target() { return target; }
      @Override public List<Row> query(String sql, Object... params) { return self.query(target, sql, params); }
      @Override public Row queryOne(String sql, Object... params) { return self.queryOne(target, sql, params); }
      @Override public ExecuteResult execute(String sql, Object... params) { return self.execute(target, sql, params); }
    };
  }

  default SqlExecutor main() { return on(DatabaseTarget.MAIN); }

  default SqlExecutor project(String projectId) { return on(DatabaseTarget.project(projectId)); }
}
