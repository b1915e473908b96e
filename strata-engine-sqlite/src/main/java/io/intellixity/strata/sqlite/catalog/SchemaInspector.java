package io.intellixity.strata.sqlite.catalog;

import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** Reads the live table/column catalog of one SQLite database. */
public final class SchemaInspector {
  private SchemaInspector() {}

  public static Set<String> tableNames(SqlExecutor db) {
    Set<String> out = new LinkedHashSet<>();
    for (Row r : db.query("SELECT name FROM sqlite_master WHERE type = 'table' AND name NOT LIKE 'sqlite_%'")) {
      out.add(r.string("name").toLowerCase(Locale.ROOT));
    }
    return out;
  }

  public static boolean tableExists(SqlExecutor db, String table) {
    return db.queryOne("SELECT name FROM sqlite_master WHERE type = 'table' AND name = ?", table) != null;
  }

  /** Column names of {@code table}; empty when the table is absent. */
  public static Set<String> columnNames(SqlExecutor db, String table) {
    Set<String> out = new LinkedHashSet<>();
    // identifiers come from the catalog, never from callers
    for (Row r : db.query("PRAGMA table_info(\"" + table.replace("\"", "") + "\")")) {
      out.add(r.string("name").toLowerCase(Locale.ROOT));
    }
    return out;
  }

  public static List<String> missingTables(SqlExecutor db, List<String> expected) {
    Set<String> live = tableNames(db);
    List<String> missing = new ArrayList<>();
    for (String t : expected) {
      if (!live.contains(t.toLowerCase(Locale.ROOT))) missing.add(t);
    }
    return missing;
  }

  public static List<TableDef> missingTableDefs(SqlExecutor db, List<TableDef> expected) {
    Set<String> live = tableNames(db);
    List<TableDef> missing = new ArrayList<>();
    for (TableDef t : expected) {
      if (!live.contains(t.name().toLowerCase(Locale.ROOT))) missing.add(t);
    }
    return missing;
  }

  public static List<ColumnDef> missingColumns(SqlExecutor db, TableDef table) {
    Set<String> live = columnNames(db, table.name());
    List<ColumnDef> missing = new ArrayList<>();
    if (live.isEmpty()) return missing;
    for (ColumnDef c : table.columns()) {
      if (!live.contains(c.name().toLowerCase(Locale.ROOT))) missing.add(c);
    }
    return missing;
  }
}
