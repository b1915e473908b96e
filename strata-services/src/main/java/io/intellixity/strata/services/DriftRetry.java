package io.intellixity.strata.services;

import io.intellixity.strata.error.SchemaDriftException;
import io.intellixity.strata.sqlite.repair.AutoRepair;
import io.intellixity.strata.sqlite.repair.RepairReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded repair-and-retry around one service operation.\n
 *
 * A {@link SchemaDriftException} triggers exactly one {@link AutoRepair#repair()} and one retry;
 * a second drift (or any other error) propagates unchanged.\n
 */
public final class DriftRetry {
  private static final Logger log = LoggerFactory.getLogger(DriftRetry.class);

  private final AutoRepair repair;

  public DriftRetry(AutoRepair repair) {
    this.repair = Objects.requireNonNull(repair, "repair");
  }

  public <T> T run(Supplier<T> work) {
    Objects.requireNonNull(work, "work");
    try {
      return work.get();
    } catch (SchemaDriftException first) {
      log.warn("strata.retry drift_detected missing={} error={}", first.missingObject(), first.getMessage());
      RepairReport report = repair.repair();
      log.info("strata.retry repaired changed={} success={}", report.changed(), report.success());
      try {
        return work.get();
      } catch (SchemaDriftException second) {
        second.addSuppressed(first);
        throw second;
      }
    }
  }

  public void runVoid(Runnable work) {
    Objects.requireNonNull(work, "work");
    run(() -> {
      work.run();
      return null;
    });
  }
}
