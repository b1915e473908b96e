package io.intellixity.strata.sqlite.health;

import io.intellixity.strata.error.StorageException;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.ExecuteResult;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.TxWork;
import io.intellixity.strata.sqlite.SqliteFixture;
import io.intellixity.strata.sqlite.system.AdminSeedSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class HealthCheckerTest {
  @TempDir Path dir;

  @Test
  void emptyMainDatabaseIsUnhealthyAndNamesMissingTables() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      HealthReport r = fx.health.check();
      assertFalse(r.healthy());
      assertEquals("Missing required tables: admin_users, projects, sessions, api_keys", r.message());
      assertEquals(List.of("admin_users", "projects", "sessions", "api_keys"), r.details().get("missingTables"));

      FullHealthReport full = fx.health.fullCheck();
      assertEquals(HealthStatus.UNHEALTHY, full.status());
      assertTrue(full.check(HealthChecker.DATABASE).passed());
      assertFalse(full.check(HealthChecker.TABLES).passed());
    }
  }

  @Test
  void catalogReadFailureAfterProbeReportsUnhealthy() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      QueryRouter failingCatalog = new QueryRouter() {
        @Override
        public List<Row> query(DatabaseTarget target, String sql, Object... params) {
          throw new StorageException("disk I/O error");
        }

        @Override
        public Row queryOne(DatabaseTarget target, String sql, Object... params) {
          return fx.router.queryOne(target, sql, params);
        }

        @Override
        public ExecuteResult execute(DatabaseTarget target, String sql, Object... params) {
          return fx.router.execute(target, sql, params);
        }

        @Override
        public <T> T transaction(DatabaseTarget target, TxWork<T> work) {
          return fx.router.transaction(target, work);
        }

        @Override
        public void executeScript(DatabaseTarget target, String script) {
          fx.router.executeScript(target, script);
        }
      };
      HealthChecker checker =
          new HealthChecker(failingCatalog, fx.locator, fx.systemChecks, AdminSeedSettings.DEFAULTS.username());

      HealthReport r = checker.check();
      assertFalse(r.healthy());
      assertEquals("Table check failed: disk I/O error", r.message());
      assertEquals("IO", r.details().get("error"));
    }
  }

  @Test
  void checkNeverRepairs() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.health.check();
      fx.health.fullCheck();
      assertFalse(fx.health.check().healthy());
    }
  }

  @Test
  void initializedDatabaseIsHealthy() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();

      HealthReport r = fx.health.check();
      assertTrue(r.healthy());
      assertEquals("Database is healthy", r.message());

      FullHealthReport full = fx.health.fullCheck();
      assertEquals(HealthStatus.HEALTHY, full.status());
      assertEquals("healthy", full.status().wire());
      assertEquals(4, full.checks().size());
    }
  }

  @Test
  void inactiveDefaultAdminDegradesButDoesNotFail() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      fx.router.main().execute("UPDATE admin_users SET is_active = 0 WHERE username = 'admin'");

      FullHealthReport full = fx.health.fullCheck();
      assertEquals(HealthStatus.DEGRADED, full.status());
      CheckResult admin = full.check(HealthChecker.DEFAULT_ADMIN);
      assertFalse(admin.passed());
      assertFalse(admin.critical());
      assertEquals("Default admin user is inactive", admin.message());
    }
  }

  @Test
  void missingInitializationRecordDegrades() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.repair();
      FullHealthReport full = fx.health.fullCheck();
      assertEquals(HealthStatus.DEGRADED, full.status());
      assertFalse(full.check(HealthChecker.INITIALIZATION).passed());
    }
  }

  @Test
  void projectCheckReportsMissingDatabaseAndMissingTables() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      assertFalse(fx.health.checkProject("ghost").healthy());
      assertFalse(fx.locator.exists("ghost"));

      fx.locator.ensure("p1");
      assertTrue(fx.health.checkProject("p1").healthy());

      fx.router.project("p1").execute("DROP TABLE changelog");
      HealthReport r = fx.health.checkProject("p1");
      assertFalse(r.healthy());
      assertEquals(List.of("changelog"), r.details().get("missingTables"));
    }
  }
}
