package io.intellixity.strata.sqlite.catalog;

import io.intellixity.strata.error.StorageException;
import io.intellixity.strata.routing.SqlExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Additive DDL: creates missing tables and columns, never drops. */
public final class SchemaWriter {
  private static final Logger log = LoggerFactory.getLogger(SchemaWriter.class);

  private SchemaWriter() {}

  /** Creates every missing table in {@code tables} with its indexes; returns the created table names. */
  public static List<String> createMissingTables(SqlExecutor db, List<TableDef> tables) {
    List<String> created = new ArrayList<>();
    for (TableDef t : SchemaInspector.missingTableDefs(db, tables)) {
      db.execute(t.createSql());
      for (String idx : t.indexes()) db.execute(idx);
      created.add(t.name());
      log.info("strata.schema create_table target={} table={}", db.target(), t.name());
    }
    return created;
  }

  /**
   * Adds catalog columns missing from live tables; returns {@code table.column} entries that were added.\n
   *
   * A column added concurrently by another repair between inspection and {@code ALTER} counts as present.\n
   */
  public static List<String> addMissingColumns(SqlExecutor db, List<TableDef> tables) {
    List<String> added = new ArrayList<>();
    for (TableDef t : tables) {
      for (ColumnDef c : SchemaInspector.missingColumns(db, t)) {
        String def = c.alterDefinition();
        if (def == null) {
          log.warn("strata.schema skip_column target={} table={} column={} reason=not_addable", db.target(), t.name(), c.name());
          continue;
        }
        if (!addColumn(db, t, c, def)) continue;
        added.add(t.name() + "." + c.name());
        log.info("strata.schema add_column target={} table={} column={}", db.target(), t.name(), c.name());
      }
    }
    return added;
  }

  private static boolean addColumn(SqlExecutor db, TableDef t, ColumnDef c, String def) {
    try {
      db.execute("ALTER TABLE " + t.name() + " ADD COLUMN " + c.name() + " " + def);
      return true;
    } catch (StorageException e) {
      if (!isDuplicateColumn(e)
          || !SchemaInspector.columnNames(db, t.name()).contains(c.name().toLowerCase(Locale.ROOT))) {
        throw e;
      }
      log.debug("strata.schema add_column_raced target={} table={} column={}", db.target(), t.name(), c.name());
      return false;
    }
  }

  static boolean isDuplicateColumn(StorageException e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      String m = t.getMessage();
      if (m != null && m.toLowerCase(Locale.ROOT).contains("duplicate column name")) return true;
    }
    return false;
  }

  /** Re-applies every catalog index ({@code IF NOT EXISTS}) for tables that exist. */
  public static void ensureIndexes(SqlExecutor db, List<TableDef> tables) {
    for (TableDef t : tables) {
      if (t.indexes().isEmpty() || !SchemaInspector.tableExists(db, t.name())) continue;
      for (String idx : t.indexes()) db.execute(idx);
    }
  }
}
