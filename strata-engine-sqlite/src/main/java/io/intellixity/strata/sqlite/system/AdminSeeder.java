package io.intellixity.strata.sqlite.system;

import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.UUID;

/** Creates or reactivates the default admin row in main. */
public final class AdminSeeder {
  private static final Logger log = LoggerFactory.getLogger(AdminSeeder.class);

  public enum Outcome { CREATED, REACTIVATED, PRESENT }

  private final QueryRouter router;
  private final AdminSeedSettings settings;

  public AdminSeeder(QueryRouter router, AdminSeedSettings settings) {
    this.router = Objects.requireNonNull(router, "router");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public AdminSeedSettings settings() { return settings; }

  public Outcome ensureDefaultAdmin() {
    Row existing = router.main().queryOne(
        "SELECT id, is_active FROM admin_users WHERE username = ?", settings.username());
    if (existing != null) {
      if (existing.bool("is_active")) return Outcome.PRESENT;
      router.main().execute(
          "UPDATE admin_users SET is_active = 1, updated_at = CURRENT_TIMESTAMP WHERE id = ?", existing.string("id"));
      log.info("strata.seed reactivate_admin username={}", settings.username());
      return Outcome.REACTIVATED;
    }

    try {
      router.main().execute(
          "INSERT INTO admin_users (id, username, email, password_hash, role, access_level, permissions, api_key, is_active) "
              + "VALUES (?, ?, ?, ?, 'master_admin', 'full', '[\"*\"]', ?, 1)",
          UUID.randomUUID().toString(), settings.username(), settings.email(), settings.passwordHash(),
          "mak_" + UUID.randomUUID().toString().replace("-", ""));
    } catch (ConflictException e) {
      log.debug("strata.seed create_admin_raced username={}", settings.username());
      return Outcome.PRESENT;
    }
    log.info("strata.seed create_admin username={}", settings.username());
    return Outcome.CREATED;
  }
}
