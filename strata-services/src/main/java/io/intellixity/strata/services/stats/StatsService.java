package io.intellixity.strata.services.stats;

import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.services.DriftRetry;
import io.intellixity.strata.sqlite.ProjectDatabaseLocator;

import java.util.Objects;

/** Read-only counters over main and project databases. */
public final class StatsService {
  private final QueryRouter router;
  private final ProjectDatabaseLocator locator;
  private final DriftRetry retry;

  public StatsService(QueryRouter router, ProjectDatabaseLocator locator, DriftRetry retry) {
    this.router = Objects.requireNonNull(router, "router");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  /** Null when the project is unknown to main. A project without a database reports zero content counts. */
  public ProjectStats projectStats(String projectId) {
    return retry.run(() -> {
      Row p = router.main().queryOne(
          "SELECT storage_used, api_calls_count, last_api_call FROM projects WHERE id = ?", projectId);
      if (p == null) return null;

      long collections = 0;
      long documents = 0;
      long files = 0;
      if (locator.exists(projectId)) {
        SqlExecutor db = router.project(projectId);
        collections = count(db, "SELECT count(*) AS n FROM collections WHERE project_id = ?", projectId);
        documents = count(db, "SELECT count(*) AS n FROM documents WHERE project_id = ? AND is_deleted = 0", projectId);
        files = count(db, "SELECT count(*) AS n FROM files WHERE project_id = ? AND is_deleted = 0", projectId);
      }
      return new ProjectStats(projectId, collections, documents, files,
          p.longValue("storage_used", 0), p.longValue("api_calls_count", 0), p.string("last_api_call"));
    });
  }

  public SystemStats systemStats() {
    return retry.run(() -> {
      SqlExecutor main = router.main();
      return new SystemStats(
          count(main, "SELECT count(*) AS n FROM projects"),
          count(main, "SELECT count(*) AS n FROM projects WHERE is_active = 1"),
          count(main, "SELECT count(*) AS n FROM admin_users"),
          count(main, "SELECT count(*) AS n FROM admin_users WHERE is_active = 1"));
    });
  }

  private static long count(SqlExecutor db, String sql, Object... params) {
    Row r = db.queryOne(sql, params);
    return r == null ? 0 : r.longValue("n", 0);
  }
}
