package io.intellixity.strata.sqlite.health;

import java.util.Locale;

public enum HealthStatus {
  HEALTHY,
  DEGRADED,
  UNHEALTHY;

  public String wire() { return name().toLowerCase(Locale.ROOT); }
}
