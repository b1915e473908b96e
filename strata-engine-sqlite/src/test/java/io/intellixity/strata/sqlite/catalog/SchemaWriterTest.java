package io.intellixity.strata.sqlite.catalog;

import io.intellixity.strata.error.StorageException;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.ExecuteResult;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.sqlite.SqliteFixture;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SchemaWriterTest {
  @TempDir Path dir;

  /** Runs every ALTER twice, as if another repair won the race between inspection and ALTER. */
  private static SqlExecutor racing(SqlExecutor db) {
    return new SqlExecutor() {
      @Override public DatabaseTarget target() { return db.target(); }
      @Override public List<Row> query(String sql, Object... params) { return db.query(sql, params); }
      @Override public Row queryOne(String sql, Object... params) { return db.queryOne(sql, params); }

      @Override
      public ExecuteResult execute(String sql, Object... params) {
        if (sql.startsWith("ALTER TABLE")) db.execute(sql, params);
        return db.execute(sql, params);
      }
    };
  }

  @Test
  void columnAddedByAConcurrentRepairCountsAsPresent() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      fx.router.main().execute("ALTER TABLE projects DROP COLUMN storage_used");

      List<String> added = SchemaWriter.addMissingColumns(racing(fx.router.main()), SchemaCatalog.MAIN_TABLES);
      assertEquals(List.of(), added);
      assertTrue(SchemaInspector.columnNames(fx.router.main(), "projects").contains("storage_used"));
    }
  }

  @Test
  void duplicateColumnFailureIsRecognized() {
    try (SqliteFixture fx = new SqliteFixture(dir)) {
      fx.repair.initialize();
      StorageException e = assertThrows(StorageException.class,
          () -> fx.router.main().execute("ALTER TABLE projects ADD COLUMN name TEXT"));
      assertTrue(SchemaWriter.isDuplicateColumn(e));
      assertFalse(SchemaWriter.isDuplicateColumn(new StorageException("disk I/O error")));
    }
  }
}
