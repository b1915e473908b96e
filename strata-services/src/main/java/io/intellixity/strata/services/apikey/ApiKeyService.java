package io.intellixity.strata.services.apikey;

import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.services.DriftRetry;
import io.intellixity.strata.sqlite.ProjectDatabaseLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Issues, resolves and revokes {@code krapi_} keys.\n
 *
 * Admin keys live in main; project keys live in their project's database. A token is unique across main
 * and every project database, so {@link #find} can search them in that order.\n
 *
 * A token that misses main touches every provisioned project database, so a lookup miss, a revoke of an
 * unknown id and every token issue open one pooled handle per project. Those handles are released right
 * away and closed by the pool's idle sweep.\n
 */
public final class ApiKeyService {
  private static final Logger log = LoggerFactory.getLogger(ApiKeyService.class);

  private static final int MAX_ATTEMPTS = 5;

  private final QueryRouter router;
  private final ProjectDatabaseLocator locator;
  private final DriftRetry retry;
  private final Clock clock;
  private final Supplier<String> tokens;

  public ApiKeyService(QueryRouter router, ProjectDatabaseLocator locator, DriftRetry retry) {
    this(router, locator, retry, Clock.systemUTC(), ApiKeyService::newToken);
  }

  public ApiKeyService(QueryRouter router,
                       ProjectDatabaseLocator locator,
                       DriftRetry retry,
                       Clock clock,
                       Supplier<String> tokens) {
    this.router = Objects.requireNonNull(router, "router");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.retry = Objects.requireNonNull(retry, "retry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.tokens = Objects.requireNonNull(tokens, "tokens");
  }

  public ApiKey createAdminKey(ApiKeySpec spec) {
    Objects.requireNonNull(spec, "spec");
    return retry.run(() -> {
      String id = UUID.randomUUID().toString();
      String token = uniqueToken();
      router.main().execute(
          "INSERT INTO api_keys (id, key, name, type, owner_id, scopes, project_ids, expires_at, rate_limit, metadata, is_active) "
              + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)",
          id, token, spec.name(), ApiKey.ADMIN, spec.ownerId(), scopes(spec), List.of(), spec.expiresAt(),
          spec.rateLimit(), metadata(spec));
      log.info("strata.apikey create type=admin id={} owner={}", id, spec.ownerId());
      return map(router.main().queryOne("SELECT * FROM api_keys WHERE id = ?", id), null);
    });
  }

  public ApiKey createProjectKey(String projectId, ApiKeySpec spec) {
    Objects.requireNonNull(spec, "spec");
    return retry.run(() -> {
      SqlExecutor db = router.project(projectId);
      String id = UUID.randomUUID().toString();
      String token = uniqueToken();
      db.execute(
          "INSERT INTO api_keys (id, key, name, type, owner_id, scopes, project_ids, expires_at, rate_limit, metadata, is_active) "
              + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1)",
          id, token, spec.name(), ApiKey.PROJECT, spec.ownerId(), scopes(spec), List.of(projectId), spec.expiresAt(),
          spec.rateLimit(), metadata(spec));
      log.info("strata.apikey create type=project id={} project={}", id, projectId);
      return map(db.queryOne("SELECT * FROM api_keys WHERE id = ?", id), projectId);
    });
  }

  /** Active, unexpired key for {@code token}; records the use. Main is searched before project databases. */
  public Optional<ApiKey> find(String token) {
    if (token == null || token.isBlank()) return Optional.empty();
    return retry.run(() -> {
      SqlExecutor main = router.main();
      Row r = main.queryOne("SELECT * FROM api_keys WHERE key = ? AND is_active = 1", token);
      if (r != null) {
        if (expired(r)) return Optional.<ApiKey>empty();
        main.execute("UPDATE api_keys SET last_used_at = CURRENT_TIMESTAMP, usage_count = usage_count + 1 WHERE id = ?",
            r.string("id"));
        return Optional.of(map(main.queryOne("SELECT * FROM api_keys WHERE id = ?", r.string("id")), null));
      }
      for (String projectId : locator.list()) {
        SqlExecutor db = router.project(projectId);
        Row pr = db.queryOne("SELECT * FROM api_keys WHERE key = ? AND is_active = 1", token);
        if (pr == null) continue;
        if (expired(pr)) return Optional.<ApiKey>empty();
        db.execute("UPDATE api_keys SET last_used_at = CURRENT_TIMESTAMP WHERE id = ?", pr.string("id"));
        return Optional.of(map(db.queryOne("SELECT * FROM api_keys WHERE id = ?", pr.string("id")), projectId));
      }
      return Optional.<ApiKey>empty();
    });
  }

  /** True when {@code token} is already issued anywhere, active or not. */
  public boolean exists(String token) {
    return retry.run(() -> tokenExists(token));
  }

  public List<ApiKey> listForProject(String projectId) {
    return retry.run(() -> {
      List<ApiKey> out = new ArrayList<>();
      for (Row r : router.project(projectId).query(
          "SELECT * FROM api_keys WHERE is_active = 1 ORDER BY created_at DESC, rowid DESC")) {
        out.add(map(r, projectId));
      }
      return out;
    });
  }

  public List<ApiKey> listForOwner(String ownerId) {
    return retry.run(() -> {
      List<ApiKey> out = new ArrayList<>();
      for (Row r : router.main().query(
          "SELECT * FROM api_keys WHERE owner_id = ? AND is_active = 1 ORDER BY created_at DESC, rowid DESC", ownerId)) {
        out.add(map(r, null));
      }
      return out;
    });
  }

  /** Deactivates the key with {@code keyId}, wherever it is stored; false when no such key exists. */
  public boolean revoke(String keyId) {
    return retry.run(() -> {
      if (router.main().execute("UPDATE api_keys SET is_active = 0 WHERE id = ?", keyId).changed() > 0) {
        log.info("strata.apikey revoke id={} target=main", keyId);
        return true;
      }
      for (String projectId : locator.list()) {
        if (router.project(projectId).execute("UPDATE api_keys SET is_active = 0, updated_at = CURRENT_TIMESTAMP "
            + "WHERE id = ?", keyId).changed() > 0) {
          log.info("strata.apikey revoke id={} target=project:{}", keyId, projectId);
          return true;
        }
      }
      return false;
    });
  }

  private String uniqueToken() {
    for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
      String token = tokens.get();
      if (!tokenExists(token)) return token;
      log.warn("strata.apikey token_collision attempt={}", attempt);
    }
    throw new ConflictException(ConflictException.DUPLICATE_API_KEY,
        "Could not generate a unique API key after " + MAX_ATTEMPTS + " attempts");
  }

  private boolean tokenExists(String token) {
    if (router.main().queryOne("SELECT id FROM api_keys WHERE key = ?", token) != null) return true;
    for (String projectId : locator.list()) {
      if (router.project(projectId).queryOne("SELECT id FROM api_keys WHERE key = ?", token) != null) return true;
    }
    return false;
  }

  private boolean expired(Row r) {
    String at = r.string("expires_at");
    if (at == null || at.isBlank()) return false;
    Instant expiry = parseInstant(at);
    if (expiry == null) {
      log.warn("strata.apikey unparsable_expiry id={} value={}", r.string("id"), at);
      return true;
    }
    return !expiry.isAfter(clock.instant());
  }

  private static Instant parseInstant(String s) {
    try {
      return Instant.parse(s);
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(s.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException e2) {
        e2.addSuppressed(e);
        log.debug("strata.apikey parse_expiry value={} error={}", s, e2.getMessage());
        return null;
      }
    }
  }

  private static List<String> scopes(ApiKeySpec spec) {
    return spec.scopes() == null ? List.of() : spec.scopes();
  }

  private static Map<String, Object> metadata(ApiKeySpec spec) {
    return spec.metadata() == null ? Map.of() : spec.metadata();
  }

  static String newToken() {
    return "krapi_" + UUID.randomUUID().toString().replace("-", "");
  }

  private static ApiKey map(Row r, String projectId) {
    return new ApiKey(
        r.string("id"),
        r.string("key"),
        r.string("name"),
        r.string("type"),
        r.string("owner_id"),
        projectId,
        r.jsonStrings("scopes"),
        r.jsonStrings("project_ids"),
        r.string("expires_at"),
        r.has("rate_limit") && r.get("rate_limit") != null ? r.longValue("rate_limit").intValue() : null,
        r.jsonMap("metadata"),
        r.bool("is_active"),
        r.string("created_at"),
        r.string("last_used_at"));
  }
}
