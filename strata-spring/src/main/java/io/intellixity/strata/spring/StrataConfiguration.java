package io.intellixity.strata.spring;

import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.services.DriftRetry;
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
import io.intellixity.strata.sqlite.health.HealthChecker;
import io.intellixity.strata.sqlite.pool.ConnectionPool;
import io.intellixity.strata.sqlite.pool.PoolSettings;
import io.intellixity.strata.sqlite.repair.AutoRepair;
import io.intellixity.strata.sqlite.repair.RepairReport;
import io.intellixity.strata.sqlite.system.AdminSeedSettings;
import io.intellixity.strata.sqlite.system.AdminSeeder;
import io.intellixity.strata.sqlite.system.SystemChecks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the engine and services from {@code strata.*} properties.\n
 *
 * With {@code strata.repair.on-startup=true} (the default) the schema is initialized as soon as the
 * {@link AutoRepair} bean is created.\n
 */
@Configuration
@EnableConfigurationProperties(StrataProperties.class)
public class StrataConfiguration {
  private static final Logger log = LoggerFactory.getLogger(StrataConfiguration.class);

  @Bean
  public StoragePaths strataStoragePaths(StrataProperties props) {
    return new StoragePaths(Path.of(props.getDataDir()));
  }

  @Bean(destroyMethod = "close")
  public ConnectionPool strataConnectionPool(StrataProperties props) {
    StrataProperties.Pool p = props.getPool();
    return new ConnectionPool(new PoolSettings(p.getMaxPoolSize(), p.getMaxIdle(), p.getBusyTimeout(), p.getConnectionTimeout()));
  }

  @Bean
  public ProjectDatabaseLocator projectDatabaseLocator(StoragePaths paths, ConnectionPool pool) {
    return new ProjectDatabaseLocator(paths, pool);
  }

  @Bean
  public SqliteQueryRouter queryRouter(ConnectionPool pool, ProjectDatabaseLocator locator) {
    return new SqliteQueryRouter(pool, locator);
  }

  @Bean
  public SchemaInitializer schemaInitializer(QueryRouter router) {
    return new SchemaInitializer(router);
  }

  @Bean
  public SystemChecks systemChecks(QueryRouter router) {
    return new SystemChecks(router);
  }

  @Bean
  public AdminSeeder adminSeeder(QueryRouter router, StrataProperties props) {
    StrataProperties.Admin a = props.getAdmin();
    return new AdminSeeder(router, new AdminSeedSettings(a.getUsername(), a.getEmail(), a.getPasswordHash()));
  }

  @Bean
  public HealthChecker healthChecker(QueryRouter router, ProjectDatabaseLocator locator, SystemChecks systemChecks,
                                     StrataProperties props) {
    return new HealthChecker(router, locator, systemChecks, props.getAdmin().getUsername());
  }

  @Bean
  public AutoRepair autoRepair(QueryRouter router,
                               ProjectDatabaseLocator locator,
                               SchemaInitializer initializer,
                               AdminSeeder seeder,
                               SystemChecks systemChecks,
                               StrataProperties props) {
    AutoRepair repair = new AutoRepair(router, locator, initializer, seeder, systemChecks);
    if (props.getRepair().isOnStartup()) {
      RepairReport report = repair.initialize();
      log.info("strata.startup initialize success={} changed={} dataDir={}", report.success(), report.changed(),
          props.getDataDir());
    }
    return repair;
  }

  @Bean
  public DriftRetry driftRetry(AutoRepair repair) {
    return new DriftRetry(repair);
  }

  @Bean
  public ChangelogService changelogService(QueryRouter router, DriftRetry retry) {
    return new ChangelogService(router, retry);
  }

  @Bean
  public CollectionService collectionService(QueryRouter router, ChangelogService changelog, DriftRetry retry) {
    return new CollectionService(router, changelog, retry);
  }

  @Bean
  public DocumentService documentService(QueryRouter router, CollectionService collections, ChangelogService changelog,
                                         DriftRetry retry) {
    return new DocumentService(router, collections, changelog, retry);
  }

  @Bean
  public ProjectService projectService(QueryRouter router, ProjectDatabaseLocator locator, DriftRetry retry) {
    return new ProjectService(router, locator, retry);
  }

  @Bean
  public ApiKeyService apiKeyService(QueryRouter router, ProjectDatabaseLocator locator, DriftRetry retry) {
    return new ApiKeyService(router, locator, retry);
  }

  @Bean
  public StatsService statsService(QueryRouter router, ProjectDatabaseLocator locator, DriftRetry retry) {
    return new StatsService(router, locator, retry);
  }

  @Bean
  public ActivityLogService activityLogService(QueryRouter router, DriftRetry retry) {
    return new ActivityLogService(router, retry);
  }
}
