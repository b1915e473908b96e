package io.intellixity.strata.sqlite.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Aggregate of the named sub-checks; see {@link HealthChecker#fullCheck()}. */
public record FullHealthReport(HealthStatus status, Map<String, CheckResult> checks) {
  public FullHealthReport {
    checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
  }

  public CheckResult check(String name) { return checks.get(name); }

  static HealthStatus aggregate(Map<String, CheckResult> checks) {
    boolean allPassed = true;
    for (CheckResult c : checks.values()) {
      if (c.passed()) continue;
      if (c.critical()) return HealthStatus.UNHEALTHY;
      allPassed = false;
    }
    return allPassed ? HealthStatus.HEALTHY : HealthStatus.DEGRADED;
  }
}
