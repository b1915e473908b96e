package io.intellixity.strata.sqlite;

import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.sqlite.catalog.SchemaCatalog;
import io.intellixity.strata.sqlite.catalog.SchemaWriter;

/** Applies the base schema to a freshly opened project database. Must be idempotent. */
@FunctionalInterface
public interface ProjectProvisioner {
  void provision(String projectId, SqlExecutor db);

  static ProjectProvisioner baseSchema() {
    return (projectId, db) -> SchemaWriter.createMissingTables(db, SchemaCatalog.PROJECT_TABLES);
  }
}
