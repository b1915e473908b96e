package io.intellixity.strata.sqlite.catalog;

import io.intellixity.strata.routing.QueryRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Creates missing main-database tables.\n
 *
 * Guarded by a process-wide initiation flag: a call that arrives while another is creating tables
 * returns empty instead of running DDL a second time.\n
 */
public final class SchemaInitializer {
  private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

  private final QueryRouter router;
  private final AtomicBoolean initializing = new AtomicBoolean();

  public SchemaInitializer(QueryRouter router) {
    this.router = Objects.requireNonNull(router, "router");
  }

  public boolean inProgress() { return initializing.get(); }

  /** Created table names, or empty when another initialization is already in flight. */
  public Optional<List<String>> createMissingTables() {
    if (!initializing.compareAndSet(false, true)) {
      log.info("strata.schema init_skipped reason=in_progress");
      return Optional.empty();
    }
    try {
      return Optional.of(SchemaWriter.createMissingTables(router.main(), SchemaCatalog.MAIN_TABLES));
    } finally {
      initializing.set(false);
    }
  }
}
