package io.intellixity.strata.sqlite.pool;

import java.nio.file.Path;
import java.sql.Connection;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One outstanding acquisition from {@link ConnectionPool}.\n
 *
 * Closing is idempotent: only the first {@link #close()} returns the connection and decrements the count.\n
 */
public final class Lease implements AutoCloseable {
  private final ConnectionPool pool;
  private final Path path;
  private final Connection connection;
  private final AtomicBoolean released = new AtomicBoolean();

  Lease(ConnectionPool pool, Path path, Connection connection) {
    this.pool = pool;
    this.path = path;
    this.connection = connection;
  }

  public Path path() { return path; }
  public Connection connection() { return connection; }
  public boolean released() { return released.get(); }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) pool.doRelease(this);
  }
}
