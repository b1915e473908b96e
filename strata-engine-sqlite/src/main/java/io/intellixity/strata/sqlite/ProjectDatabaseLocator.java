package io.intellixity.strata.sqlite;

import io.intellixity.strata.error.StorageException;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.sqlite.pool.ConnectionPool;
import io.intellixity.strata.sqlite.pool.Lease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Maps project ids to database files and provisions them on first touch.\n
 *
 * Concurrent {@link #ensure} calls for the same unseen project serialize on a per-project lock:
 * exactly one caller provisions, the rest observe the provisioned state.\n
 */
public final class ProjectDatabaseLocator {
  private static final Logger log = LoggerFactory.getLogger(ProjectDatabaseLocator.class);

  private final StoragePaths paths;
  private final ConnectionPool pool;
  private final ProjectProvisioner provisioner;

  private final Set<String> provisioned = ConcurrentHashMap.newKeySet();
  private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();
  private final AtomicInteger created = new AtomicInteger();

  public ProjectDatabaseLocator(StoragePaths paths, ConnectionPool pool) {
    this(paths, pool, ProjectProvisioner.baseSchema());
  }

  public ProjectDatabaseLocator(StoragePaths paths, ConnectionPool pool, ProjectProvisioner provisioner) {
    this.paths = Objects.requireNonNull(paths, "paths");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.provisioner = Objects.requireNonNull(provisioner, "provisioner");
  }

  public StoragePaths paths() { return paths; }

  public Path pathFor(String projectId) { return paths.projectDb(projectId); }

  /** Filesystem check only; never opens the database. */
  public boolean exists(String projectId) { return Files.isRegularFile(pathFor(projectId)); }

  /** Creates the database file and base schema if needed. Idempotent and safe under concurrent first access. */
  public void ensure(String projectId) {
    Path db = pathFor(projectId);
    if (provisioned.contains(projectId)) return;

    Object lock = locks.computeIfAbsent(projectId, k -> new Object());
    synchronized (lock) {
      if (provisioned.contains(projectId)) return;
      boolean fresh = !Files.exists(db);
      try {
        Files.createDirectories(paths.projectFilesDir(projectId));
      } catch (IOException e) {
        throw new StorageException("Cannot create project directory for " + projectId, e);
      }

      long start = System.nanoTime();
      try (Lease lease = pool.acquire(db)) {
        provisioner.provision(projectId, new ConnectionExecutor(DatabaseTarget.project(projectId), lease.connection()));
      }
      provisioned.add(projectId);
      if (fresh) created.incrementAndGet();
      log.info("strata.locator provision projectId={} fresh={} durationMs={}",
          projectId, fresh, (System.nanoTime() - start) / 1_000_000.0);
    }
  }

  public boolean isProvisioned(String projectId) { return provisioned.contains(projectId); }

  /** Number of database files this locator has created. */
  public int createdCount() { return created.get(); }

  public void close(String projectId) {
    pool.close(pathFor(projectId));
  }

  /** Closes the handle and removes the project directory. Logical rows must already be purged. */
  public void delete(String projectId) {
    Path dir = paths.projectDir(projectId);
    Object lock = locks.computeIfAbsent(projectId, k -> new Object());
    synchronized (lock) {
      close(projectId);
      provisioned.remove(projectId);
      if (!Files.exists(dir)) return;
      try (Stream<Path> walk = Files.walk(dir)) {
        walk.sorted(Comparator.reverseOrder()).forEach(p -> {
          try {
            Files.delete(p);
          } catch (IOException e) {
            throw new UncheckedIOException(e);
          }
        });
      } catch (IOException | UncheckedIOException e) {
        throw new StorageException("Failed to delete project database " + projectId, e);
      }
      log.info("strata.locator delete projectId={}", projectId);
    }
  }

  /** Ids of project directories that contain a database file. */
  public List<String> list() {
    Path root = paths.projectsDir();
    List<String> out = new ArrayList<>();
    if (!Files.isDirectory(root)) return out;
    try (Stream<Path> dirs = Files.list(root)) {
      dirs.filter(Files::isDirectory)
          .filter(d -> Files.isRegularFile(d.resolve(StoragePaths.PROJECT_FILE)))
          .map(d -> d.getFileName().toString())
          .sorted()
          .forEach(out::add);
    } catch (IOException e) {
      throw new StorageException("Failed to list project databases", e);
    }
    return out;
  }
}
