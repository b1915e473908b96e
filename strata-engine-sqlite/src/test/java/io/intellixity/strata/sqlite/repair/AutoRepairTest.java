package io.intellixity.strata.sqlite.repair;

import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.ExecuteResult;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.TxWork;
import io.intellixity.strata.sqlite.SqliteFixture;
import io.intellixity.strata.sqlite.catalog.SchemaInitializer;
import io.intellixity.strata.sqlite.catalog.SchemaInspector;
import io.intellixity.strata.sqlite.system.SystemCheck;
import io.intellixity.strata.sqlite.system.SystemChecks;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class AutoRepairTest {
  @TempDir Path dir;

  @Test
  void firstRepairBuildsEverythingSecondIsNoOp() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      RepairReport first = fx.repair.repair();
      assertTrue(first.success());
      assertTrue(first.changed());
      assertTrue(first.repairs().get(0).startsWith("Created missing tables: admin_users, projects"));
      assertTrue(first.repairs().contains("Created default admin user 'admin'"));

      RepairReport second = fx.repair.repair();
      assertTrue(second.success());
      assertFalse(second.changed());
      assertEquals(List.of("All required tables present", "No missing columns", "Default admin present and active"),
          second.repairs());

      RepairReport third = fx.repair.repair();
      assertEquals(second, third);
    }
  }

  @Test
  void droppedColumnIsAddedBackWithoutLosingRows() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      fx.router.main().execute("INSERT INTO projects (id, name, api_key) VALUES ('p1', 'one', 'pk_1')");
      fx.router.main().execute("ALTER TABLE projects DROP COLUMN storage_used");
      assertFalse(SchemaInspector.columnNames(fx.router.main(), "projects").contains("storage_used"));

      RepairReport r = fx.repair.repair();
      assertTrue(r.changed());
      assertTrue(r.repairs().contains("Added missing columns: projects.storage_used"));

      Row row = fx.router.main().queryOne("SELECT name, storage_used FROM projects WHERE id = 'p1'");
      assertEquals("one", row.string("name"));
      assertEquals(0L, row.longValue("storage_used"));
    }
  }

  @Test
  void concurrentRepairsOfTheSameDroppedColumnAllSucceed() throws Exception {
    int threads = 6;
    ExecutorService exec = Executors.newFixedThreadPool(threads);
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      for (int round = 0; round < 5; round++) {
        fx.router.main().execute("ALTER TABLE projects DROP COLUMN storage_used");
        CountDownLatch start = new CountDownLatch(1);
        List<Future<RepairReport>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
          futures.add(exec.submit(() -> {
            start.await();
            return fx.repair.repair();
          }));
        }
        start.countDown();
        int added = 0;
        for (Future<RepairReport> f : futures) {
          RepairReport r = f.get(30, TimeUnit.SECONDS);
          assertTrue(r.success(), () -> String.valueOf(r.repairs()));
          if (r.repairs().contains("Added missing columns: projects.storage_used")) added++;
        }
        assertTrue(added >= 1);
        assertTrue(SchemaInspector.columnNames(fx.router.main(), "projects").contains("storage_used"));
        assertTrue(fx.systemChecks.find(SystemChecks.DATABASE_REPAIR).get().succeeded());
      }
    } finally {
      exec.shutdownNow();
    }
  }

  @Test
  void legacyPasswordColumnIsRenamed() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.main().execute("CREATE TABLE admin_users (id TEXT PRIMARY KEY, username TEXT UNIQUE NOT NULL, "
          + "email TEXT UNIQUE NOT NULL, password TEXT NOT NULL, is_active INTEGER DEFAULT 1)");
      fx.router.main().execute(
          "INSERT INTO admin_users (id, username, email, password) VALUES ('u1', 'old', 'old@x.io', 'h1')");

      RepairReport r = fx.repair.repair();
      assertTrue(r.success(), () -> String.valueOf(r.repairs()));
      assertTrue(r.repairs().contains("Renamed admin_users.password to password_hash"));

      Row row = fx.router.main().queryOne("SELECT password_hash, role FROM admin_users WHERE id = 'u1'");
      assertEquals("h1", row.string("password_hash"));
      assertEquals("admin", row.string("role"));
      assertFalse(SchemaInspector.columnNames(fx.router.main(), "admin_users").contains("password"));
    }
  }

  @Test
  void missingTablesAreRecreatedInMainAndProjects() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      fx.locator.ensure("p1");
      fx.router.main().execute("DROP TABLE sessions");
      fx.router.project("p1").execute("DROP TABLE folders");

      RepairReport r = fx.repair.repair();
      assertTrue(r.repairs().contains("Created missing tables: sessions"));
      assertTrue(r.repairs().contains("Created missing tables in project p1: folders"));
      assertTrue(SchemaInspector.tableExists(fx.router.project("p1"), "folders"));
      assertTrue(fx.health.check().healthy());
    }
  }

  @Test
  void deactivatedAdminIsReactivated() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      fx.router.main().execute("UPDATE admin_users SET is_active = 0");
      RepairReport r = fx.repair.repair();
      assertTrue(r.repairs().contains("Reactivated default admin user 'admin'"));
      assertTrue(fx.router.main().queryOne("SELECT is_active FROM admin_users WHERE username = 'admin'").bool("is_active"));
    }
  }

  @Test
  void repairAndInitializationAreRecorded() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      Optional<SystemCheck> init = fx.systemChecks.find(SystemChecks.DATABASE_INITIALIZATION);
      Optional<SystemCheck> repair = fx.systemChecks.find(SystemChecks.DATABASE_REPAIR);
      assertTrue(init.isPresent());
      assertTrue(init.get().succeeded());
      assertTrue(repair.isPresent());
      assertEquals(1L, fx.router.main().queryOne(
          "SELECT count(*) AS n FROM system_checks WHERE check_type = ?", SystemChecks.DATABASE_REPAIR).longValue("n"));

      fx.repair.repair();
      assertEquals(1L, fx.router.main().queryOne(
          "SELECT count(*) AS n FROM system_checks WHERE check_type = ?", SystemChecks.DATABASE_REPAIR).longValue("n"));
    }
  }

  @Test
  void reentrantInitializationIsSkipped() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      AtomicReference<SchemaInitializer> self = new AtomicReference<>();
      AtomicReference<Optional<List<String>>> nested = new AtomicReference<>();
      QueryRouter reentrant = new QueryRouter() {
        @Override
        public List<Row> query(DatabaseTarget target, String sql, Object... params) {
          if (nested.get() == null) nested.set(self.get().createMissingTables());
          return fx.router.query(target, sql, params);
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
      SchemaInitializer initializer = new SchemaInitializer(reentrant);
      self.set(initializer);

      Optional<List<String>> outer = initializer.createMissingTables();
      assertTrue(outer.isPresent());
      assertFalse(outer.get().isEmpty());
      assertEquals(Optional.empty(), nested.get());
      assertFalse(initializer.inProgress());
    }
  }
}
