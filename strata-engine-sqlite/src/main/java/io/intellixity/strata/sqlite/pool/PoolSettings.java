package io.intellixity.strata.sqlite.pool;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-database pool tuning.\n
 *
 * @param maxPoolSize       connections per database file
 * @param maxIdle           a handle with no outstanding leases is closed after this long; zero disables eviction
 * @param busyTimeout       SQLite busy_timeout for lock waits
 * @param connectionTimeout how long {@code acquire} waits for a free connection
 */
public record PoolSettings(int maxPoolSize, Duration maxIdle, Duration busyTimeout, Duration connectionTimeout) {
  public static final PoolSettings DEFAULTS =
      new PoolSettings(4, Duration.ofMinutes(10), Duration.ofSeconds(10), Duration.ofSeconds(30));

  public PoolSettings {
    if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
    Objects.requireNonNull(maxIdle, "maxIdle");
    Objects.requireNonNull(busyTimeout, "busyTimeout");
    Objects.requireNonNull(connectionTimeout, "connectionTimeout");
    if (maxIdle.isNegative()) throw new IllegalArgumentException("maxIdle must be >= 0");
  }
}
