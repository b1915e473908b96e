package io.intellixity.strata.sqlite.system;

import java.util.Map;

/** Last recorded outcome for one check type. */
public record SystemCheck(String checkType, String status, Map<String, Object> details, String lastChecked) {
  public boolean succeeded() { return SystemChecks.SUCCESS.equals(status); }
}
