package io.intellixity.strata.services.apikey;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An issued API key.\n
 *
 * {@code projectId} is null for admin keys stored in main, and the owning project for keys stored in a
 * project database.\n
 */
public record ApiKey(String id,
                     String key,
                     String name,
                     String type,
                     String ownerId,
                     String projectId,
                     List<String> scopes,
                     List<String> projectIds,
                     String expiresAt,
                     Integer rateLimit,
                     Map<String, Object> metadata,
                     boolean active,
                     String createdAt,
                     String lastUsedAt) {
  public static final String ADMIN = "admin";
  public static final String PROJECT = "project";

  public ApiKey {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(key, "key");
    scopes = scopes == null ? List.of() : List.copyOf(scopes);
    projectIds = projectIds == null ? List.of() : List.copyOf(projectIds);
    metadata = metadata == null ? Map.of() : metadata;
  }

  public boolean isProjectKey() { return projectId != null; }
}
