package io.intellixity.strata.sqlite.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnDefTest {
  @Test
  void alterDefinitionDropsWhatAddColumnRejects() {
    assertNull(new ColumnDef("id", "TEXT PRIMARY KEY").alterDefinition());
    assertFalse(new ColumnDef("id", "TEXT PRIMARY KEY").addable());

    assertEquals("TEXT", new ColumnDef("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP").alterDefinition());
    assertEquals("TEXT", new ColumnDef("key", "TEXT UNIQUE NOT NULL").alterDefinition());
    assertEquals("TEXT NOT NULL DEFAULT '[]'", new ColumnDef("fields", "TEXT NOT NULL DEFAULT '[]'").alterDefinition());
    assertEquals("INTEGER DEFAULT 0", new ColumnDef("n", "INTEGER DEFAULT 0").alterDefinition());
  }

  @Test
  void everyCatalogTableRendersCreateSql() {
    for (TableDef t : SchemaCatalog.MAIN_TABLES) {
      assertTrue(t.createSql().startsWith("CREATE TABLE IF NOT EXISTS " + t.name() + " ("), t.name());
    }
    for (TableDef t : SchemaCatalog.PROJECT_TABLES) {
      assertTrue(t.column("id").isPresent(), t.name());
    }
    assertTrue(SchemaCatalog.projectTable("COLLECTIONS").isPresent());
    assertTrue(SchemaCatalog.mainTable("nope").isEmpty());
  }
}
