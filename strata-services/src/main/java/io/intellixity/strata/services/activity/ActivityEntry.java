package io.intellixity.strata.services.activity;

import java.util.Map;
import java.util.Objects;

/** One row of the main {@code activity_logs} table. {@code id} and {@code createdAt} are assigned on insert. */
public record ActivityEntry(String id,
                            String userId,
                            String userType,
                            String projectId,
                            String action,
                            String entityType,
                            String entityId,
                            Map<String, Object> details,
                            String ipAddress,
                            String userAgent,
                            String sessionId,
                            String createdAt) {
  public ActivityEntry {
    Objects.requireNonNull(action, "action");
    details = details == null ? Map.of() : details;
  }

  public static ActivityEntry of(String userId, String projectId, String action, String entityType, String entityId) {
    return new ActivityEntry(null, userId, null, projectId, action, entityType, entityId, Map.of(), null, null, null, null);
  }

  public ActivityEntry withDetails(Map<String, Object> d) {
    return new ActivityEntry(id, userId, userType, projectId, action, entityType, entityId, d, ipAddress, userAgent,
        sessionId, createdAt);
  }
}
