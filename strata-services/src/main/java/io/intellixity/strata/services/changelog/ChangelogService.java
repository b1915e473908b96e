package io.intellixity.strata.services.changelog;

import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.services.DriftRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only audit trail of collection and document mutations, kept per project.\n
 *
 * {@link #record(SqlExecutor, String, String, String, String, String, Map, String)} takes an executor so
 * callers can write the entry inside the same transaction as the mutation.\n
 */
public final class ChangelogService {
  private static final Logger log = LoggerFactory.getLogger(ChangelogService.class);

  public static final String COLLECTION = "collection";
  public static final String DOCUMENT = "document";

  public static final String CREATE = "create";
  public static final String UPDATE = "update";
  public static final String DELETE = "delete";
  public static final String PURGE = "purge";

  private final QueryRouter router;
  private final DriftRetry retry;

  public ChangelogService(QueryRouter router, DriftRetry retry) {
    this.router = Objects.requireNonNull(router, "router");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  public String record(SqlExecutor db,
                       String projectId,
                       String collectionId,
                       String entityType,
                       String entityId,
                       String action,
                       Map<String, ?> changes,
                       String userId) {
    String id = UUID.randomUUID().toString();
    db.execute("INSERT INTO changelog (id, project_id, collection_id, action, entity_type, entity_id, changes, user_id) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
        id, projectId, collectionId, action, entityType, entityId, changes == null ? Map.of() : changes, userId);
    log.debug("strata.changelog record project={} entity={}:{} action={}", projectId, entityType, entityId, action);
    return id;
  }

  /** Newest first. */
  public List<ChangelogEntry> list(String projectId, int limit) {
    return retry.run(() -> map(router.project(projectId).query(
        "SELECT * FROM changelog WHERE project_id = ? ORDER BY created_at DESC, rowid DESC LIMIT ?",
        projectId, clamp(limit))));
  }

  public List<ChangelogEntry> listForEntity(String projectId, String entityType, String entityId) {
    return retry.run(() -> map(router.project(projectId).query(
        "SELECT * FROM changelog WHERE project_id = ? AND entity_type = ? AND entity_id = ? "
            + "ORDER BY created_at DESC, rowid DESC",
        projectId, entityType, entityId)));
  }

  /** Deletes entries older than {@code days}; returns the number removed. */
  public long purgeOlderThan(String projectId, int days) {
    if (days < 0) throw new IllegalArgumentException("days must be >= 0");
    long removed = retry.run(() -> router.project(projectId).execute(
        "DELETE FROM changelog WHERE project_id = ? AND created_at < datetime('now', ?)",
        projectId, "-" + days + " days").changed());
    log.info("strata.changelog purge project={} olderThanDays={} removed={}", projectId, days, removed);
    return removed;
  }

  private static int clamp(int limit) {
    return limit <= 0 ? 100 : Math.min(limit, 1000);
  }

  private static List<ChangelogEntry> map(List<Row> rows) {
    List<ChangelogEntry> out = new ArrayList<>(rows.size());
    for (Row r : rows) {
      out.add(new ChangelogEntry(
          r.string("id"),
          r.string("project_id"),
          r.string("collection_id"),
          r.string("action"),
          r.string("entity_type"),
          r.string("entity_id"),
          r.jsonMap("changes"),
          r.string("user_id"),
          r.string("created_at")));
    }
    return out;
  }
}
