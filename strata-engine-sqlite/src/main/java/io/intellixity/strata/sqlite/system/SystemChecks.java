package io.intellixity.strata.sqlite.system;

import io.intellixity.strata.json.Json;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/** One row per check type in the main {@code system_checks} table. */
public final class SystemChecks {
  public static final String DATABASE_INITIALIZATION = "database_initialization";
  public static final String DATABASE_REPAIR = "database_repair";
  public static final String SUCCESS = "success";
  public static final String FAILED = "failed";

  private final QueryRouter router;

  public SystemChecks(QueryRouter router) {
    this.router = Objects.requireNonNull(router, "router");
  }

  public void record(String checkType, String status, Map<String, ?> details) {
    router.main().execute(
        "INSERT INTO system_checks (id, check_type, status, details, last_checked) "
            + "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP) "
            + "ON CONFLICT(check_type) DO UPDATE SET status = excluded.status, details = excluded.details, "
            + "last_checked = CURRENT_TIMESTAMP",
        UUID.randomUUID().toString(), checkType, status, Json.write(details == null ? Map.of() : details));
  }

  public Optional<SystemCheck> find(String checkType) {
    Row r = router.main().queryOne(
        "SELECT check_type, status, details, last_checked FROM system_checks WHERE check_type = ?", checkType);
    if (r == null) return Optional.empty();
    return Optional.of(new SystemCheck(r.string("check_type"), r.string("status"), r.jsonMap("details"), r.string("last_checked")));
  }
}
