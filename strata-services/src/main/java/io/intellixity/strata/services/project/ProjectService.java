package io.intellixity.strata.services.project;

import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.error.ValidationException;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.services.DriftRetry;
import io.intellixity.strata.sqlite.ProjectDatabaseLocator;
import io.intellixity.strata.sqlite.catalog.SchemaCatalog;
import io.intellixity.strata.sqlite.catalog.SchemaInspector;
import io.intellixity.strata.sqlite.catalog.TableDef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Project lifecycle in the main database, and provisioning/removal of each project's own database.\n
 */
public final class ProjectService {
  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final QueryRouter router;
  private final ProjectDatabaseLocator locator;
  private final DriftRetry retry;

  public ProjectService(QueryRouter router, ProjectDatabaseLocator locator, DriftRetry retry) {
    this.router = Objects.requireNonNull(router, "router");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  /** Inserts the project row, provisions its database, and returns the stored row. */
  public Project create(ProjectSpec spec, String createdBy) {
    Objects.requireNonNull(spec, "spec");
    String name = spec.name() == null ? "" : spec.name().trim();
    if (name.isEmpty()) throw new ValidationException("Project name is required");

    return retry.run(() -> {
      SqlExecutor main = router.main();
      if (main.queryOne("SELECT id FROM projects WHERE name = ?", name) != null) throw duplicate(name, null);

      String id = UUID.randomUUID().toString();
      try {
        main.execute("INSERT INTO projects (id, name, description, owner_id, api_key, project_url, allowed_origins, "
                + "settings, is_active, created_by) VALUES (?, ?, ?, ?, ?, ?, ?, ?, 1, ?)",
            id, name, spec.description(), createdBy, newProjectKey(), spec.projectUrl(),
            spec.allowedOrigins() == null ? List.of() : spec.allowedOrigins(),
            spec.settings() == null ? Map.of() : spec.settings(),
            createdBy);
      } catch (ConflictException e) {
        if (!ConflictException.UNIQUE_CONSTRAINT.equals(e.code())) throw e;
        throw duplicate(name, e);
      }
      locator.ensure(id);
      log.info("strata.project create id={} name={}", id, name);
      return find(id);
    });
  }

  /** Null when absent. */
  public Project get(String id) {
    return retry.run(() -> find(id));
  }

  /** Active project owning {@code apiKey}, or null. */
  public Project getByApiKey(String apiKey) {
    return retry.run(() -> {
      Row r = router.main().queryOne("SELECT * FROM projects WHERE api_key = ? AND is_active = 1", apiKey);
      return r == null ? null : map(r);
    });
  }

  public List<Project> list(boolean includeInactive) {
    return retry.run(() -> {
      List<Project> out = new ArrayList<>();
      String sql = includeInactive
          ? "SELECT * FROM projects ORDER BY created_at DESC, rowid DESC"
          : "SELECT * FROM projects WHERE is_active = 1 ORDER BY created_at DESC, rowid DESC";
      for (Row r : router.main().query(sql)) out.add(map(r));
      return out;
    });
  }

  /** Null when absent. */
  public Project update(String id, ProjectUpdate update) {
    Objects.requireNonNull(update, "update");
    return retry.run(() -> {
      Project existing = find(id);
      if (existing == null) return null;
      if (update.isEmpty()) return existing;

      List<String> sets = new ArrayList<>();
      List<Object> params = new ArrayList<>();
      if (update.name() != null) {
        String name = update.name().trim();
        if (name.isEmpty()) throw new ValidationException("Project name is required");
        if (!name.equals(existing.name())
            && router.main().queryOne("SELECT id FROM projects WHERE name = ? AND id <> ?", name, id) != null) {
          throw duplicate(name, null);
        }
        sets.add("name = ?");
        params.add(name);
      }
      if (update.description() != null) {
        sets.add("description = ?");
        params.add(update.description());
      }
      if (update.projectUrl() != null) {
        sets.add("project_url = ?");
        params.add(update.projectUrl());
      }
      if (update.active() != null) {
        sets.add("is_active = ?");
        params.add(update.active());
      }
      if (update.allowedOrigins() != null) {
        sets.add("allowed_origins = ?");
        params.add(update.allowedOrigins());
      }
      if (update.settings() != null) {
        sets.add("settings = ?");
        params.add(update.settings());
      }
      sets.add("updated_at = CURRENT_TIMESTAMP");
      params.add(id);
      router.main().execute("UPDATE projects SET " + String.join(", ", sets) + " WHERE id = ?", params.toArray());
      log.info("strata.project update id={} columns={}", id, sets.size() - 1);
      return find(id);
    });
  }

  /**
   * Purges the project's tables, removes its database directory, then deletes the main rows.\n
   *
   * @return false when the project does not exist
   */
  public boolean delete(String id) {
    return retry.run(() -> {
      if (find(id) == null) return false;
      if (locator.exists(id)) {
        SqlExecutor db = router.project(id);
        for (TableDef t : SchemaCatalog.PROJECT_TABLES) {
          if (SchemaInspector.tableExists(db, t.name())) db.execute("DELETE FROM " + t.name());
        }
        locator.delete(id);
      }
      SqlExecutor main = router.main();
      main.execute("DELETE FROM project_admins WHERE project_id = ?", id);
      long n = main.execute("DELETE FROM projects WHERE id = ?", id).changed();
      log.info("strata.project delete id={} removed={}", id, n);
      return n > 0;
    });
  }

  /** New key, or null when the project does not exist. */
  public String regenerateApiKey(String id) {
    return retry.run(() -> {
      String key = newProjectKey();
      long n = router.main().execute(
          "UPDATE projects SET api_key = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?", key, id).changed();
      if (n == 0) return null;
      log.info("strata.project regenerate_key id={}", id);
      return key;
    });
  }

  public void recordApiCall(String id) {
    retry.runVoid(() -> router.main().execute(
        "UPDATE projects SET api_calls_count = api_calls_count + 1, last_api_call = CURRENT_TIMESTAMP WHERE id = ?", id));
  }

  public void updateStorageUsed(String id, long bytes) {
    if (bytes < 0) throw new ValidationException("Storage used cannot be negative");
    retry.runVoid(() -> router.main().execute(
        "UPDATE projects SET storage_used = ?, updated_at = CURRENT_TIMESTAMP WHERE id = ?", bytes, id));
  }

  private Project find(String id) {
    Row r = router.main().queryOne("SELECT * FROM projects WHERE id = ?", id);
    return r == null ? null : map(r);
  }

  private static String newProjectKey() {
    return "pk_" + UUID.randomUUID().toString().replace("-", "");
  }

  private static ConflictException duplicate(String name, Throwable cause) {
    String msg = "Project with this name already exists: " + name;
    return cause == null
        ? new ConflictException(ConflictException.DUPLICATE_PROJECT_NAME, msg)
        : new ConflictException(ConflictException.DUPLICATE_PROJECT_NAME, msg, cause);
  }

  private static Project map(Row r) {
    return new Project(
        r.string("id"),
        r.string("name"),
        r.string("description"),
        r.string("owner_id"),
        r.string("api_key"),
        r.string("project_url"),
        r.jsonStrings("allowed_origins"),
        r.jsonMap("settings"),
        r.bool("is_active"),
        r.longValue("storage_used", 0),
        r.longValue("api_calls_count", 0),
        r.string("last_api_call"),
        r.string("created_by"),
        r.string("created_at"),
        r.string("updated_at"));
  }
}
