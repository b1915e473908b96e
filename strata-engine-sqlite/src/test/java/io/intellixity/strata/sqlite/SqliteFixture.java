package io.intellixity.strata.sqlite;

import io.intellixity.strata.sqlite.catalog.SchemaInitializer;
import io.intellixity.strata.sqlite.health.HealthChecker;
import io.intellixity.strata.sqlite.pool.ConnectionPool;
import io.intellixity.strata.sqlite.pool.PoolSettings;
import io.intellixity.strata.sqlite.repair.AutoRepair;
import io.intellixity.strata.sqlite.system.AdminSeedSettings;
import io.intellixity.strata.sqlite.system.AdminSeeder;
import io.intellixity.strata.sqlite.system.SystemChecks;

import java.nio.file.Path;

/** Fully wired engine over a temporary data directory. */
public final class SqliteFixture implements AutoCloseable {
  public final StoragePaths paths;
  public final ConnectionPool pool;
  public final ProjectDatabaseLocator locator;
  public final SqliteQueryRouter router;
  public final SchemaInitializer initializer;
  public final SystemChecks systemChecks;
  public final AdminSeeder seeder;
  public final HealthChecker health;
  public final AutoRepair repair;

  public SqliteFixture(Path dataDir) {
    this(dataDir, PoolSettings.DEFAULTS);
  }

  public SqliteFixture(Path dataDir, PoolSettings settings) {
    this.paths = new StoragePaths(dataDir);
    this.pool = new ConnectionPool(settings);
    this.locator = new ProjectDatabaseLocator(paths, pool);
    this.router = new SqliteQueryRouter(pool, locator);
    this.initializer = new SchemaInitializer(router);
    this.systemChecks = new SystemChecks(router);
    this.seeder = new AdminSeeder(router, AdminSeedSettings.DEFAULTS);
    this.health = new HealthChecker(router, locator, systemChecks, AdminSeedSettings.DEFAULTS.username());
    this.repair = new AutoRepair(router, locator, initializer, seeder, systemChecks);
  }

  @Override
  public void close() {
    pool.close();
  }
}
