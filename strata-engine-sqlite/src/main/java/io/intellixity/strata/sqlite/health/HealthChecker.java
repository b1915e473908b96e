package io.intellixity.strata.sqlite.health;

import io.intellixity.strata.error.StrataException;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.sqlite.ProjectDatabaseLocator;
import io.intellixity.strata.sqlite.catalog.SchemaCatalog;
import io.intellixity.strata.sqlite.catalog.SchemaInspector;
import io.intellixity.strata.sqlite.catalog.TableDef;
import io.intellixity.strata.sqlite.system.SystemCheck;
import io.intellixity.strata.sqlite.system.SystemChecks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only inspection of main and project databases.\n
 *
 * Never repairs anything; see {@code AutoRepair}.\n
 */
public final class HealthChecker {
  private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);

  public static final String DATABASE = "database";
  public static final String TABLES = "tables";
  public static final String DEFAULT_ADMIN = "defaultAdmin";
  public static final String INITIALIZATION = "initialization";

  private final QueryRouter router;
  private final ProjectDatabaseLocator locator;
  private final SystemChecks systemChecks;
  private final String adminUsername;

  public HealthChecker(QueryRouter router, ProjectDatabaseLocator locator, SystemChecks systemChecks, String adminUsername) {
    this.router = Objects.requireNonNull(router, "router");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.systemChecks = Objects.requireNonNull(systemChecks, "systemChecks");
    this.adminUsername = Objects.requireNonNull(adminUsername, "adminUsername");
  }

  /** Trivial query against main, then presence of the critical tables. */
  public HealthReport check() {
    SqlExecutor main = router.main();
    try {
      main.queryOne("SELECT 1 AS ok");
    } catch (StrataException e) {
      log.warn("strata.health probe_failed error={}", e.getMessage());
      return new HealthReport(false, "Database connection failed: " + e.getMessage(), Map.of("error", e.kind().name()));
    }
    List<String> missing;
    try {
      missing = SchemaInspector.missingTables(main, SchemaCatalog.CRITICAL_MAIN_TABLES);
    } catch (StrataException e) {
      log.warn("strata.health table_check_failed error={}", e.getMessage());
      return new HealthReport(false, "Table check failed: " + e.getMessage(), Map.of("error", e.kind().name()));
    }
    if (!missing.isEmpty()) {
      return new HealthReport(false, "Missing required tables: " + String.join(", ", missing),
          Map.of("missingTables", missing));
    }
    return new HealthReport(true, "Database is healthy", Map.of("tables", SchemaCatalog.CRITICAL_MAIN_TABLES));
  }

  /** Four independent sub-checks; database and tables are critical. */
  public FullHealthReport fullCheck() {
    Map<String, CheckResult> checks = new LinkedHashMap<>();
    checks.put(DATABASE, databaseCheck());
    checks.put(TABLES, tablesCheck());
    checks.put(DEFAULT_ADMIN, defaultAdminCheck());
    checks.put(INITIALIZATION, initializationCheck());
    HealthStatus status = FullHealthReport.aggregate(checks);
    log.debug("strata.health full_check status={}", status.wire());
    return new FullHealthReport(status, checks);
  }

  /** Presence of every project table in one project's database; does not provision. */
  public HealthReport checkProject(String projectId) {
    if (!locator.exists(projectId)) {
      return new HealthReport(false, "Project database not found", Map.of("projectId", projectId));
    }
    try {
      List<String> expected = new ArrayList<>();
      for (TableDef t : SchemaCatalog.PROJECT_TABLES) expected.add(t.name());
      List<String> missing = SchemaInspector.missingTables(router.project(projectId), expected);
      if (!missing.isEmpty()) {
        return new HealthReport(false, "Missing project tables: " + String.join(", ", missing),
            Map.of("projectId", projectId, "missingTables", missing));
      }
      return new HealthReport(true, "Project database is healthy", Map.of("projectId", projectId));
    } catch (StrataException e) {
      return new HealthReport(false, "Project database check failed: " + e.getMessage(),
          Map.of("projectId", projectId, "error", e.kind().name()));
    }
  }

  private CheckResult databaseCheck() {
    try {
      Row r = router.main().queryOne("SELECT 1 AS ok");
      return (r != null && r.longValue("ok", 0) == 1)
          ? CheckResult.pass("Database connection is working", true)
          : CheckResult.fail("Database probe returned no result", true);
    } catch (StrataException e) {
      return CheckResult.fail("Database connection failed: " + e.getMessage(), true);
    }
  }

  private CheckResult tablesCheck() {
    try {
      List<String> missing = SchemaInspector.missingTables(router.main(), SchemaCatalog.CRITICAL_MAIN_TABLES);
      return missing.isEmpty()
          ? CheckResult.pass("All required tables exist", true)
          : CheckResult.fail("Missing required tables: " + String.join(", ", missing), true);
    } catch (StrataException e) {
      return CheckResult.fail("Table check failed: " + e.getMessage(), true);
    }
  }

  private CheckResult defaultAdminCheck() {
    try {
      Row r = router.main().queryOne("SELECT is_active FROM admin_users WHERE username = ?", adminUsername);
      if (r == null) return CheckResult.fail("Default admin user not found", false);
      if (!r.bool("is_active")) return CheckResult.fail("Default admin user is inactive", false);
      return CheckResult.pass("Default admin user exists and is active", false);
    } catch (StrataException e) {
      return CheckResult.fail("Default admin check failed: " + e.getMessage(), false);
    }
  }

  private CheckResult initializationCheck() {
    try {
      Optional<SystemCheck> init = systemChecks.find(SystemChecks.DATABASE_INITIALIZATION);
      if (init.isEmpty()) return CheckResult.fail("Database initialization has not been recorded", false);
      return init.get().succeeded()
          ? CheckResult.pass("Database initialization completed at " + init.get().lastChecked(), false)
          : CheckResult.fail("Last database initialization status: " + init.get().status(), false);
    } catch (StrataException e) {
      return CheckResult.fail("Initialization check failed: " + e.getMessage(), false);
    }
  }
}
