package io.intellixity.strata.sqlite.health;

/** One sub-check of {@link HealthChecker#fullCheck()}; a failed critical check makes the instance unhealthy. */
public record CheckResult(boolean passed, String message, boolean critical) {
  public static CheckResult pass(String message, boolean critical) { return new CheckResult(true, message, critical); }
  public static CheckResult fail(String message, boolean critical) { return new CheckResult(false, message, critical); }
}
