package io.intellixity.strata.sqlite;

import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.error.SchemaDriftException;
import io.intellixity.strata.error.StorageException;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.ExecuteResult;
import io.intellixity.strata.routing.Row;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SqliteQueryRouterTest {
  private static final String KV = "CREATE TABLE IF NOT EXISTS kv (k TEXT PRIMARY KEY, v TEXT)";

  @TempDir Path dir;

  @Test
  void projectAndMainTargetsNeverCross() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.execute(DatabaseTarget.MAIN, KV);
      fx.router.execute(DatabaseTarget.project("p1"), KV);
      fx.router.execute(DatabaseTarget.project("p2"), KV);

      fx.router.execute(DatabaseTarget.MAIN, "INSERT INTO kv (k, v) VALUES (?, ?)", "where", "main");
      fx.router.execute(DatabaseTarget.project("p1"), "INSERT INTO kv (k, v) VALUES (?, ?)", "where", "p1");

      assertEquals("main", fx.router.queryOne(DatabaseTarget.MAIN, "SELECT v FROM kv WHERE k = ?", "where").string("v"));
      assertEquals("p1", fx.router.queryOne(DatabaseTarget.project("p1"), "SELECT v FROM kv WHERE k = ?", "where").string("v"));
      assertNull(fx.router.queryOne(DatabaseTarget.project("p2"), "SELECT v FROM kv WHERE k = ?", "where"));

      assertTrue(fx.pool.isOpen(fx.paths.mainDb()));
      assertTrue(fx.pool.isOpen(fx.locator.pathFor("p1")));
      assertEquals(0, fx.pool.outstanding());
    }
  }

  @Test
  void projectTargetsAreProvisionedOnFirstTouch() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      assertFalse(fx.locator.exists("lazy"));
      List<Row> rows = fx.router.query(DatabaseTarget.project("lazy"), "SELECT count(*) AS n FROM collections");
      assertEquals(0L, rows.get(0).longValue("n"));
      assertTrue(fx.locator.exists("lazy"));
    }
  }

  @Test
  void executeReportsChangesAndInsertedRowId() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.execute(DatabaseTarget.MAIN, "CREATE TABLE seq (id INTEGER PRIMARY KEY AUTOINCREMENT, flag INTEGER, meta TEXT)");
      ExecuteResult first = fx.router.execute(DatabaseTarget.MAIN, "INSERT INTO seq (flag, meta) VALUES (?, ?)", true, Map.of("a", 1));
      ExecuteResult second = fx.router.execute(DatabaseTarget.MAIN, "INSERT INTO seq (flag, meta) VALUES (?, ?)", false, null);
      assertEquals(new ExecuteResult(1, 1L), first);
      assertEquals(2L, second.insertedId());

      ExecuteResult upd = fx.router.execute(DatabaseTarget.MAIN, "UPDATE seq SET flag = 0");
      assertEquals(2, upd.changed());
      assertNull(upd.insertedId());

      Row r = fx.router.queryOne(DatabaseTarget.MAIN, "SELECT flag, meta FROM seq WHERE id = 1");
      assertFalse(r.bool("flag"));
      assertEquals(Map.of("a", 1), r.jsonMap("meta"));
    }
  }

  @Test
  void failedTransactionLeavesNoTrace() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      DatabaseTarget p = DatabaseTarget.project("tx");
      fx.router.execute(p, KV);
      fx.router.execute(p, "INSERT INTO kv (k, v) VALUES ('a', 'before')");

      IllegalStateException ex = assertThrows(IllegalStateException.class, () -> fx.router.transaction(p, tx -> {
        tx.execute("UPDATE kv SET v = 'during' WHERE k = 'a'");
        tx.execute("INSERT INTO kv (k, v) VALUES ('b', 'new')");
        assertEquals("during", tx.queryOne("SELECT v FROM kv WHERE k = 'a'").string("v"));
        throw new IllegalStateException("boom");
      }));
      assertEquals("boom", ex.getMessage());

      assertEquals("before", fx.router.queryOne(p, "SELECT v FROM kv WHERE k = 'a'").string("v"));
      assertNull(fx.router.queryOne(p, "SELECT v FROM kv WHERE k = 'b'"));
      assertEquals(0, fx.pool.outstanding());
    }
  }

  @Test
  void sqlErrorInsideTransactionRollsBackAndPropagatesTranslated() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.execute(DatabaseTarget.MAIN, KV);
      assertThrows(ConflictException.class, () -> fx.router.transaction(DatabaseTarget.MAIN, tx -> {
        tx.execute("INSERT INTO kv (k, v) VALUES ('x', '1')");
        tx.execute("INSERT INTO kv (k, v) VALUES ('x', '2')");
        return null;
      }));
      assertNull(fx.router.queryOne(DatabaseTarget.MAIN, "SELECT v FROM kv WHERE k = 'x'"));
    }
  }

  @Test
  void successfulTransactionCommitsAndReturnsResult() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.execute(DatabaseTarget.MAIN, KV);
      int n = fx.router.transaction(DatabaseTarget.MAIN, tx -> {
        tx.execute("INSERT INTO kv (k, v) VALUES ('a', '1')");
        tx.execute("INSERT INTO kv (k, v) VALUES ('b', '2')");
        return tx.query("SELECT k FROM kv").size();
      });
      assertEquals(2, n);
      assertEquals(2, fx.router.query(DatabaseTarget.MAIN, "SELECT k FROM kv").size());
    }
  }

  @Test
  void driverErrorsAreClassified() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.execute(DatabaseTarget.MAIN, KV);

      SchemaDriftException col = assertThrows(SchemaDriftException.class,
          () -> fx.router.query(DatabaseTarget.MAIN, "SELECT missing_col FROM kv"));
      assertEquals("missing_col", col.missingObject());

      SchemaDriftException named = assertThrows(SchemaDriftException.class,
          () -> fx.router.execute(DatabaseTarget.MAIN, "INSERT INTO kv (k, nope) VALUES ('a', 'b')"));
      assertEquals("kv.nope", named.missingObject());

      assertThrows(SchemaDriftException.class, () -> fx.router.query(DatabaseTarget.MAIN, "SELECT * FROM ghost"));
      assertThrows(StorageException.class, () -> fx.router.query(DatabaseTarget.MAIN, "SELEC nonsense"));
      assertEquals(0, fx.pool.outstanding());
    }
  }

  @Test
  void scriptsRunStatementByStatement() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.router.executeScript(DatabaseTarget.MAIN, KV + "; INSERT INTO kv (k, v) VALUES ('s', '1');");
      assertNotNull(fx.router.main().queryOne("SELECT v FROM kv WHERE k = 's'"));
    }
  }
}
