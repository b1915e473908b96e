package io.intellixity.strata.sqlite.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.strata.error.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Reference-counted SQLite pools keyed by database file.\n
 *
 * - One {@link HikariDataSource} per path, created on first {@link #acquire}.\n
 * - Handle creation and lease counting are atomic per path ({@link ConcurrentHashMap#compute}).\n
 * - Handles with no outstanding leases are closed once idle longer than {@link PoolSettings#maxIdle()};
 *   expiry is swept on every acquire, like an access-order cache prune.\n
 * - Open failures surface as {@link StorageException} and are not retried.\n
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionPool.class);
  private static final AtomicInteger POOL_SEQ = new AtomicInteger();

  private final PoolSettings settings;
  private final LongSupplier nowMillis;
  private final ConcurrentHashMap<Path, Slot> slots = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();

  private static final class Slot {
    final HikariDataSource ds;
    // mutated only inside compute/computeIfPresent for this slot's key
    volatile int outstanding;
    volatile long idleSince;

    Slot(HikariDataSource ds, long now) {
      this.ds = ds;
      this.idleSince = now;
    }
  }

  public ConnectionPool(PoolSettings settings) {
    this(settings, System::currentTimeMillis);
  }

  public ConnectionPool(PoolSettings settings, LongSupplier nowMillis) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  public PoolSettings settings() { return settings; }

  /** Acquires a connection for the database at {@code databasePath}; the caller must close the lease. */
  public Lease acquire(Path databasePath) {
    Objects.requireNonNull(databasePath, "databasePath");
    if (closed.get()) throw new IllegalStateException("ConnectionPool is closed");
    Path key = databasePath.toAbsolutePath().normalize();
    evictIdle();

    Slot slot = slots.compute(key, (k, s) -> {
      Slot live = (s == null) ? open(k) : s;
      live.outstanding++;
      return live;
    });

    try {
      Connection c = slot.ds.getConnection();
      if (log.isTraceEnabled()) log.trace("strata.pool acquire path={} outstanding={}", key, slot.outstanding);
      return new Lease(this, key, c);
    } catch (SQLException e) {
      decrement(key);
      throw new StorageException("Failed to acquire connection for " + key, e);
    } catch (RuntimeException e) {
      decrement(key);
      throw e;
    }
  }

  /** Idempotent; equivalent to {@link Lease#close()}. */
  public void release(Lease lease) {
    Objects.requireNonNull(lease, "lease").close();
  }

  void doRelease(Lease lease) {
    try {
      lease.connection().close();
    } catch (SQLException e) {
      log.warn("strata.pool connection close failed path={} error={}", lease.path(), e.getMessage());
    } finally {
      decrement(lease.path());
    }
  }

  private void decrement(Path key) {
    Slot s = slots.computeIfPresent(key, (k, slot) -> {
      slot.outstanding = Math.max(0, slot.outstanding - 1);
      if (slot.outstanding == 0) slot.idleSince = nowMillis.getAsLong();
      return slot;
    });
    if (s == null) log.debug("strata.pool release after handle close path={}", key);
    else if (log.isTraceEnabled()) log.trace("strata.pool release path={} outstanding={}", key, s.outstanding);
  }

  /** Closes handles with no outstanding leases that have been idle for at least {@code maxIdle}. */
  public int evictIdle() {
    long idleMillis = settings.maxIdle().toMillis();
    if (idleMillis <= 0 || slots.isEmpty()) return 0;
    long now = nowMillis.getAsLong();
    AtomicInteger evicted = new AtomicInteger();
    for (Path key : slots.keySet()) {
      slots.computeIfPresent(key, (k, s) -> {
        if (s.outstanding == 0 && (now - s.idleSince) >= idleMillis) {
          s.ds.close();
          evicted.incrementAndGet();
          log.info("strata.pool evict path={} idleMs={}", k, now - s.idleSince);
          return null;
        }
        return s;
      });
    }
    return evicted.get();
  }

  /** Closes the handle for one database (e.g. before its file is deleted). */
  public void close(Path databasePath) {
    Path key = Objects.requireNonNull(databasePath, "databasePath").toAbsolutePath().normalize();
    Slot removed = slots.remove(key);
    if (removed == null) return;
    if (removed.outstanding > 0) {
      log.warn("strata.pool closing handle with outstanding leases path={} outstanding={}", key, removed.outstanding);
    }
    removed.ds.close();
    log.info("strata.pool close path={}", key);
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) return;
    for (Path key : slots.keySet()) close(key);
  }

  public int outstanding() {
    int n = 0;
    for (Slot s : slots.values()) n += s.outstanding;
    return n;
  }

  public int outstanding(Path databasePath) {
    Slot s = slots.get(databasePath.toAbsolutePath().normalize());
    return s == null ? 0 : s.outstanding;
  }

  public int openHandles() { return slots.size(); }

  public boolean isClosed() { return closed.get(); }

  public boolean isOpen(Path databasePath) {
    return slots.containsKey(databasePath.toAbsolutePath().normalize());
  }

  private Slot open(Path path) {
    try {
      Path parent = path.getParent();
      if (parent != null) Files.createDirectories(parent);
    } catch (IOException e) {
      throw new StorageException("Cannot create directory for database " + path, e);
    }

    HikariConfig hc = new HikariConfig();
    hc.setPoolName("strata-" + POOL_SEQ.incrementAndGet());
    hc.setJdbcUrl("jdbc:sqlite:" + path);
    hc.setDriverClassName("org.sqlite.JDBC");
    hc.setMaximumPoolSize(settings.maxPoolSize());
    hc.setMinimumIdle(1);
    hc.setConnectionTimeout(Math.max(250L, settings.connectionTimeout().toMillis()));
    hc.addDataSourceProperty("journal_mode", "WAL");
    hc.addDataSourceProperty("busy_timeout", String.valueOf(settings.busyTimeout().toMillis()));
    hc.addDataSourceProperty("foreign_keys", "true");

    try {
      HikariDataSource ds = new HikariDataSource(hc);
      log.info("strata.pool open path={} pool={} maxPoolSize={}", path, hc.getPoolName(), settings.maxPoolSize());
      return new Slot(ds, nowMillis.getAsLong());
    } catch (RuntimeException e) {
      throw new StorageException("Failed to open database " + path, e);
    }
  }
}
