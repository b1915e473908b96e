package io.intellixity.strata.services.project;

import java.util.List;
import java.util.Map;

/** Input to {@link ProjectService#create}. */
public record ProjectSpec(String name,
                          String description,
                          String projectUrl,
                          List<String> allowedOrigins,
                          Map<String, Object> settings) {
  public static ProjectSpec named(String name) {
    return new ProjectSpec(name, null, null, List.of(), Map.of());
  }
}
