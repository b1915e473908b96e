package io.intellixity.strata.services.changelog;

import java.util.Map;

/** One row of a project's {@code changelog} table. */
public record ChangelogEntry(String id,
                             String projectId,
                             String collectionId,
                             String action,
                             String entityType,
                             String entityId,
                             Map<String, Object> changes,
                             String userId,
                             String createdAt) {
  public ChangelogEntry {
    changes = changes == null ? Map.of() : changes;
  }
}
