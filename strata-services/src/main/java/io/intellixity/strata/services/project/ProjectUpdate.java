package io.intellixity.strata.services.project;

import java.util.List;
import java.util.Map;

/** Partial update; null components are left unchanged. */
public record ProjectUpdate(String name,
                            String description,
                            String projectUrl,
                            Boolean active,
                            List<String> allowedOrigins,
                            Map<String, Object> settings) {
  public boolean isEmpty() {
    return name == null && description == null && projectUrl == null && active == null
        && allowedOrigins == null && settings == null;
  }

  public static ProjectUpdate active(boolean active) {
    return new ProjectUpdate(null, null, null, active, null, null);
  }

  public static ProjectUpdate rename(String name) {
    return new ProjectUpdate(name, null, null, null, null, null);
  }
}
