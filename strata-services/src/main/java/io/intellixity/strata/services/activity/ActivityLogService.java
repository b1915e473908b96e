package io.intellixity.strata.services.activity;

import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.services.DriftRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** User-visible activity trail in the main database. */
public final class ActivityLogService {
  private static final Logger log = LoggerFactory.getLogger(ActivityLogService.class);

  private final QueryRouter router;
  private final DriftRetry retry;

  public ActivityLogService(QueryRouter router, DriftRetry retry) {
    this.router = Objects.requireNonNull(router, "router");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  /** Stores the entry and returns its id. */
  public String log(ActivityEntry entry) {
    Objects.requireNonNull(entry, "entry");
    String id = entry.id() == null ? UUID.randomUUID().toString() : entry.id();
    retry.runVoid(() -> router.main().execute(
        "INSERT INTO activity_logs (id, user_id, user_type, project_id, action, entity_type, entity_id, details, "
            + "ip_address, user_agent, session_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
        id, entry.userId(), entry.userType(), entry.projectId(), entry.action(), entry.entityType(), entry.entityId(),
        entry.details(), entry.ipAddress(), entry.userAgent(), entry.sessionId()));
    log.debug("strata.activity log id={} action={} project={}", id, entry.action(), entry.projectId());
    return id;
  }

  /** Newest first; a null {@code projectId} spans all projects. */
  public List<ActivityEntry> recent(String projectId, int limit) {
    int n = limit <= 0 ? 50 : Math.min(limit, 1000);
    return retry.run(() -> {
      List<Row> rows = projectId == null
          ? router.main().query("SELECT * FROM activity_logs ORDER BY created_at DESC, rowid DESC LIMIT ?", n)
          : router.main().query(
              "SELECT * FROM activity_logs WHERE project_id = ? ORDER BY created_at DESC, rowid DESC LIMIT ?", projectId, n);
      List<ActivityEntry> out = new ArrayList<>(rows.size());
      for (Row r : rows) {
        out.add(new ActivityEntry(
            r.string("id"),
            r.string("user_id"),
            r.string("user_type"),
            r.string("project_id"),
            r.string("action"),
            r.string("entity_type"),
            r.string("entity_id"),
            r.jsonMap("details"),
            r.string("ip_address"),
            r.string("user_agent"),
            r.string("session_id"),
            r.string("created_at")));
      }
      return out;
    });
  }
}
