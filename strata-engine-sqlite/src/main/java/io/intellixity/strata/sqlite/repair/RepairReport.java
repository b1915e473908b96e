package io.intellixity.strata.sqlite.repair;

import java.util.List;

/**
 * Outcome of one repair pass.\n
 *
 * {@code repairs} always holds one line per step, including "nothing needed" lines.\n
 */
public record RepairReport(List<String> repairs, boolean changed, boolean success) {
  public RepairReport {
    repairs = List.copyOf(repairs);
  }
}
