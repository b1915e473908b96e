package io.intellixity.strata.services;

import io.intellixity.strata.services.activity.ActivityLogService;
import io.intellixity.strata.services.apikey.ApiKeyService;
import io.intellixity.strata.services.changelog.ChangelogService;
import io.intellixity.strata.services.collection.CollectionService;
import io.intellixity.strata.services.document.DocumentService;
import io.intellixity.strata.services.project.ProjectService;
import io.intellixity.strata.services.stats.StatsService;
import io.intellixity.strata.sqlite.ProjectDatabaseLocator;
import io.intellixity.strata.sqlite.SqliteQueryRouter;
import io.intellixity.strata.sqlite.StoragePaths;
import io.intellixity.strata.sqlite.catalog.SchemaInitializer;
import io.intellixity.strata.sqlite.pool.ConnectionPool;
import io.intellixity.strata.sqlite.pool.PoolSettings;
import io.intellixity.strata.sqlite.repair.AutoRepair;
import io.intellixity.strata.sqlite.system.AdminSeedSettings;
import io.intellixity.strata.sqlite.system.AdminSeeder;
import io.intellixity.strata.sqlite.system.SystemChecks;

import java.nio.file.Path;

/** Engine plus every service over a temporary, initialized data directory. */
public final class ServicesFixture implements AutoCloseable {
  public final ConnectionPool pool;
  public final ProjectDatabaseLocator locator;
  public final SqliteQueryRouter router;
  public final AutoRepair repair;
  public final DriftRetry retry;
  public final ChangelogService changelog;
  public final CollectionService collections;
  public final DocumentService documents;
  public final ProjectService projects;
  public final ApiKeyService apiKeys;
  public final StatsService stats;
  public final ActivityLogService activity;

  public ServicesFixture(Path dataDir) {
    this.pool = new ConnectionPool(PoolSettings.DEFAULTS);
    this.locator = new ProjectDatabaseLocator(new StoragePaths(dataDir), pool);
    this.router = new SqliteQueryRouter(pool, locator);
    this.repair = new AutoRepair(router, locator, new SchemaInitializer(router),
        new AdminSeeder(router, AdminSeedSettings.DEFAULTS), new SystemChecks(router));
    this.retry = new DriftRetry(repair);
    this.changelog = new ChangelogService(router, retry);
    this.collections = new CollectionService(router, changelog, retry);
    this.documents = new DocumentService(router, collections, changelog, retry);
    this.projects = new ProjectService(router, locator, retry);
    this.apiKeys = new ApiKeyService(router, locator, retry);
    this.stats = new StatsService(router, locator, retry);
    this.activity = new ActivityLogService(router, retry);
    repair.initialize();
  }

  @Override
  public void close() {
    pool.close();
  }
}
