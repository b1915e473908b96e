package io.intellixity.strata.sqlite.repair;

import io.intellixity.strata.error.SchemaDriftException;
import io.intellixity.strata.error.StrataException;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.sqlite.ProjectDatabaseLocator;
import io.intellixity.strata.sqlite.catalog.SchemaCatalog;
import io.intellixity.strata.sqlite.catalog.SchemaInitializer;
import io.intellixity.strata.sqlite.catalog.SchemaInspector;
import io.intellixity.strata.sqlite.catalog.SchemaWriter;
import io.intellixity.strata.sqlite.catalog.TableDef;
import io.intellixity.strata.sqlite.system.AdminSeeder;
import io.intellixity.strata.sqlite.system.SystemChecks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Idempotent, additive schema repair.\n
 *
 * Steps, in order:\n
 * - tables: create missing main tables (behind {@link SchemaInitializer}'s initiation guard) and missing
 *   tables of provisioned project databases\n
 * - columns: add catalog columns missing from live tables; the only rename is the legacy
 *   {@code admin_users.password -> password_hash}\n
 * - admin: create or reactivate the default admin\n
 *
 * A failing step is reported in the log and does not stop later steps.\n
 */
public final class AutoRepair {
  private static final Logger log = LoggerFactory.getLogger(AutoRepair.class);

  private final QueryRouter router;
  private final ProjectDatabaseLocator locator;
  private final SchemaInitializer initializer;
  private final AdminSeeder seeder;
  private final SystemChecks systemChecks;

  public AutoRepair(QueryRouter router,
                    ProjectDatabaseLocator locator,
                    SchemaInitializer initializer,
                    AdminSeeder seeder,
                    SystemChecks systemChecks) {
    this.router = Objects.requireNonNull(router, "router");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.initializer = Objects.requireNonNull(initializer, "initializer");
    this.seeder = Objects.requireNonNull(seeder, "seeder");
    this.systemChecks = Objects.requireNonNull(systemChecks, "systemChecks");
  }

  public RepairReport repair() {
    long start = System.nanoTime();
    List<String> repairs = new ArrayList<>();
    boolean changed = false;
    boolean success = true;

    try {
      changed |= repairTables(repairs);
    } catch (StrataException e) {
      success = false;
      repairs.add("Table repair failed: " + e.getMessage());
      log.error("strata.repair step=tables error={}", e.getMessage(), e);
    }

    try {
      changed |= repairColumns(repairs);
    } catch (StrataException e) {
      success = false;
      repairs.add("Column repair failed: " + e.getMessage());
      log.error("strata.repair step=columns error={}", e.getMessage(), e);
    }

    try {
      changed |= repairAdmin(repairs);
    } catch (StrataException e) {
      success = false;
      repairs.add("Default admin repair failed: " + e.getMessage());
      log.error("strata.repair step=admin error={}", e.getMessage(), e);
    }

    RepairReport report = new RepairReport(repairs, changed, success);
    record(SystemChecks.DATABASE_REPAIR, report);
    log.info("strata.repair done changed={} success={} durationMs={} repairs={}",
        changed, success, (System.nanoTime() - start) / 1_000_000.0, repairs);
    return report;
  }

  /** First-boot path: a full repair pass recorded as the database initialization. */
  public RepairReport initialize() {
    RepairReport report = repair();
    record(SystemChecks.DATABASE_INITIALIZATION, report);
    return report;
  }

  private boolean repairTables(List<String> repairs) {
    boolean changed = false;
    List<String> missing = SchemaInspector.missingTables(router.main(), tableNames(SchemaCatalog.MAIN_TABLES));
    if (missing.isEmpty()) {
      repairs.add("All required tables present");
    } else {
      Optional<List<String>> created = initializer.createMissingTables();
      if (created.isEmpty()) {
        repairs.add("Table initialization already in progress; skipped: " + String.join(", ", missing));
      } else {
        repairs.add("Created missing tables: " + String.join(", ", created.get()));
        changed = !created.get().isEmpty();
      }
    }

    for (String projectId : locator.list()) {
      List<String> created = SchemaWriter.createMissingTables(router.project(projectId), SchemaCatalog.PROJECT_TABLES);
      if (!created.isEmpty()) {
        repairs.add("Created missing tables in project " + projectId + ": " + String.join(", ", created));
        changed = true;
      }
    }
    return changed;
  }

  private boolean repairColumns(List<String> repairs) {
    List<String> added = new ArrayList<>();
    SqlExecutor main = router.main();

    if (renameLegacyPassword(main)) {
      repairs.add("Renamed admin_users.password to password_hash");
      added.add("admin_users.password_hash");
    }
    added.addAll(SchemaWriter.addMissingColumns(main, SchemaCatalog.MAIN_TABLES));
    SchemaWriter.ensureIndexes(main, SchemaCatalog.MAIN_TABLES);

    for (String projectId : locator.list()) {
      SqlExecutor db = router.project(projectId);
      for (String col : SchemaWriter.addMissingColumns(db, SchemaCatalog.PROJECT_TABLES)) {
        added.add(projectId + ":" + col);
      }
      SchemaWriter.ensureIndexes(db, SchemaCatalog.PROJECT_TABLES);
    }

    if (added.isEmpty()) {
      repairs.add("No missing columns");
      return false;
    }
    repairs.add("Added missing columns: " + String.join(", ", added));
    return true;
  }

  private static boolean renameLegacyPassword(SqlExecutor main) {
    Set<String> cols = SchemaInspector.columnNames(main, "admin_users");
    if (!cols.contains("password") || cols.contains("password_hash")) return false;
    try {
      main.execute("ALTER TABLE admin_users RENAME COLUMN password TO password_hash");
    } catch (SchemaDriftException e) {
      // a concurrent repair renamed it first
      if (!SchemaInspector.columnNames(main, "admin_users").contains("password_hash")) throw e;
      return false;
    }
    log.info("strata.repair legacy_rename table=admin_users from=password to=password_hash");
    return true;
  }

  private boolean repairAdmin(List<String> repairs) {
    String username = seeder.settings().username();
    return switch (seeder.ensureDefaultAdmin()) {
      case CREATED -> {
        repairs.add("Created default admin user '" + username + "'");
        yield true;
      }
      case REACTIVATED -> {
        repairs.add("Reactivated default admin user '" + username + "'");
        yield true;
      }
      case PRESENT -> {
        repairs.add("Default admin present and active");
        yield false;
      }
    };
  }

  private void record(String checkType, RepairReport report) {
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("repairs", report.repairs());
    details.put("changed", report.changed());
    try {
      systemChecks.record(checkType, report.success() ? SystemChecks.SUCCESS : SystemChecks.FAILED, details);
    } catch (StrataException e) {
      log.warn("strata.repair record_failed checkType={} error={}", checkType, e.getMessage());
    }
  }

  private static List<String> tableNames(List<TableDef> tables) {
    List<String> out = new ArrayList<>(tables.size());
    for (TableDef t : tables) out.add(t.name());
    return out;
  }
}
