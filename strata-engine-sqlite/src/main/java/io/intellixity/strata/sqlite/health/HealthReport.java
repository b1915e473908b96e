package io.intellixity.strata.sqlite.health;

import java.util.Map;

/** Result of the fast probe. */
public record HealthReport(boolean healthy, String message, Map<String, Object> details) {
  public HealthReport {
    details = details == null ? Map.of() : Map.copyOf(details);
  }
}
