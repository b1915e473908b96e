package io.intellixity.strata.sqlite.catalog;

import java.util.Objects;

/**
 * One column as declared in {@code CREATE TABLE}.\n
 *
 * {@link #alterDefinition()} is the form usable with {@code ALTER TABLE ... ADD COLUMN}: SQLite rejects
 * PRIMARY KEY/UNIQUE there, and non-constant defaults such as CURRENT_TIMESTAMP.\n
 */
public record ColumnDef(String name, String definition) {
  public ColumnDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(definition, "definition");
  }

  /** Null when the column cannot be added after table creation. */
  public String alterDefinition() {
    String d = " " + definition + " ";
    if (d.contains(" PRIMARY KEY ")) return null;
    d = d.replace(" DEFAULT CURRENT_TIMESTAMP ", " ").replace(" UNIQUE ", " ");
    if (d.contains(" NOT NULL ") && !d.contains(" DEFAULT ")) d = d.replace(" NOT NULL ", " ");
    return d.trim().replaceAll("\\s+", " ");
  }

  public boolean addable() { return alterDefinition() != null; }
}
