package io.intellixity.strata.services.project;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A tenant as recorded in the main database's {@code projects} table. */
public record Project(String id,
                      String name,
                      String description,
                      String ownerId,
                      String apiKey,
                      String projectUrl,
                      List<String> allowedOrigins,
                      Map<String, Object> settings,
                      boolean active,
                      long storageUsed,
                      long apiCallsCount,
                      String lastApiCall,
                      String createdBy,
                      String createdAt,
                      String updatedAt) {
  public Project {
    Objects.requireNonNull(id, "id");
    allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    settings = settings == null ? Map.of() : settings;
  }
}
