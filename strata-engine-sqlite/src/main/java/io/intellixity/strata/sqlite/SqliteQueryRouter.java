package io.intellixity.strata.sqlite;

import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.ExecuteResult;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.TxWork;
import io.intellixity.strata.sqlite.pool.ConnectionPool;
import io.intellixity.strata.sqlite.pool.Lease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * {@link QueryRouter} over per-file SQLite pools.\n
 *
 * Every entry point: resolve target (provisioning project databases on first touch), acquire, execute,
 * release in {@code finally}. Routing never inspects SQL.\n
 */
public final class SqliteQueryRouter implements QueryRouter {
  private static final Logger log = LoggerFactory.getLogger(SqliteQueryRouter.class);

  private final ConnectionPool pool;
  private final ProjectDatabaseLocator locator;

  public SqliteQueryRouter(ConnectionPool pool, ProjectDatabaseLocator locator) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  public ProjectDatabaseLocator locator() { return locator; }

  /** Physical file a target resolves to. Provisions project databases as a side effect. */
  public Path resolve(DatabaseTarget target) {
    Objects.requireNonNull(target, "target");
    if (target.isMain()) return locator.paths().mainDb();
    locator.ensure(target.projectId());
    return locator.pathFor(target.projectId());
  }

  @Override
  public List<Row> query(DatabaseTarget target, String sql, Object... params) {
    return withConnection(target, ex -> ex.query(sql, params));
  }

  @Override
  public Row queryOne(DatabaseTarget target, String sql, Object... params) {
    return withConnection(target, ex -> ex.queryOne(sql, params));
  }

  @Override
  public ExecuteResult execute(DatabaseTarget target, String sql, Object... params) {
    return withConnection(target, ex -> ex.execute(sql, params));
  }

  @Override
  public void executeScript(DatabaseTarget target, String script) {
    withConnection(target, ex -> {
      ex.script(script);
      return null;
    });
  }

  @Override
  public <T> T transaction(DatabaseTarget target, TxWork<T> work) {
    Objects.requireNonNull(work, "work");
    Path path = resolve(target);
    try (Lease lease = pool.acquire(path)) {
      Connection c = lease.connection();
      begin(target, c);
      try {
        T result = work.run(new ConnectionExecutor(target, c));
        commit(target, c);
        return result;
      } catch (RuntimeException | Error e) {
        rollback(target, c, e);
        throw e;
      } finally {
        restoreAutoCommit(target, c);
      }
    }
  }

  private <T> T withConnection(DatabaseTarget target, Function<ConnectionExecutor, T> op) {
    Path path = resolve(target);
    try (Lease lease = pool.acquire(path)) {
      return op.apply(new ConnectionExecutor(target, lease.connection()));
    }
  }

  private static void begin(DatabaseTarget target, Connection c) {
    try {
      c.setAutoCommit(false);
      log.debug("strata.tx op=BEGIN target={}", target);
    } catch (SQLException e) {
      throw SqliteErrors.translate(e, target, "begin");
    }
  }

  private static void commit(DatabaseTarget target, Connection c) {
    try {
      c.commit();
      log.debug("strata.tx op=COMMIT target={}", target);
    } catch (SQLException e) {
      throw SqliteErrors.translate(e, target, "commit");
    }
  }

  /** Never masks {@code cause}: a failed rollback is logged and attached as suppressed. */
  private static void rollback(DatabaseTarget target, Connection c, Throwable cause) {
    try {
      c.rollback();
      log.debug("strata.tx op=ROLLBACK target={} cause={}", target, cause.getClass().getSimpleName());
    } catch (SQLException | RuntimeException e) {
      log.error("strata.tx rollback_failed target={} error={}", target, e.getMessage(), e);
      cause.addSuppressed(e);
    }
  }

  private static void restoreAutoCommit(DatabaseTarget target, Connection c) {
    try {
      c.setAutoCommit(true);
    } catch (SQLException e) {
      log.warn("strata.tx autocommit_restore_failed target={} error={}", target, e.getMessage());
    }
  }
}
