package io.intellixity.strata.services.collection;

import com.fasterxml.jackson.core.type.TypeReference;
import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.error.ValidationException;
import io.intellixity.strata.json.Json;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.schema.Collection;
import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.Identifiers;
import io.intellixity.strata.schema.IndexDef;
import io.intellixity.strata.schema.validation.SchemaValidator;
import io.intellixity.strata.services.DriftRetry;
import io.intellixity.strata.services.changelog.ChangelogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Schema registry: runtime-declared collections stored in each project's database.\n
 *
 * Lookup by name or id ({@link #getByNameOrId}):\n
 * - a syntactically valid UUID is looked up by id only\n
 * - anything else is URL-decoded and trimmed, matched exactly, then case-insensitively; a case-insensitive
 *   hit is re-resolved by its canonical name\n
 */
public final class CollectionService {
  private static final Logger log = LoggerFactory.getLogger(CollectionService.class);

  private static final TypeReference<List<FieldDef>> FIELDS = new TypeReference<>() {};
  private static final TypeReference<List<IndexDef>> INDEXES = new TypeReference<>() {};

  private final QueryRouter router;
  private final ChangelogService changelog;
  private final DriftRetry retry;

  public CollectionService(QueryRouter router, ChangelogService changelog, DriftRetry retry) {
    this.router = Objects.requireNonNull(router, "router");
    this.changelog = Objects.requireNonNull(changelog, "changelog");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  public Collection create(String projectId, String name, CollectionSpec spec, String createdBy) {
    Objects.requireNonNull(spec, "spec");
    if (!Identifiers.isName(name)) {
      throw new ValidationException("Invalid collection name: " + name
          + ". Use only letters, numbers, and underscores, starting with a letter or underscore.");
    }
    SchemaValidator.validate(spec.fields()).orThrow();
    SchemaValidator.validateIndexes(spec.indexes(), spec.fields()).orThrow();

    return retry.run(() -> {
      SqlExecutor db = router.project(projectId);
      Row clash = db.queryOne(
          "SELECT name FROM collections WHERE project_id = ? AND name = ? COLLATE NOCASE", projectId, name);
      if (clash != null) throw duplicate(name, null);

      String id = UUID.randomUUID().toString();
      try {
        router.transaction(DatabaseTarget.project(projectId), tx -> {
          tx.execute("INSERT INTO collections (id, project_id, name, description, fields, indexes, created_by) "
                  + "VALUES (?, ?, ?, ?, ?, ?, ?)",
              id, projectId, name, spec.description(), Json.write(spec.fields()), Json.write(spec.indexes()), createdBy);
          changelog.record(tx, projectId, id, ChangelogService.COLLECTION, id, ChangelogService.CREATE,
              Map.of("name", name, "fields", spec.fields().size()), createdBy);
          return null;
        });
      } catch (ConflictException e) {
        if (!ConflictException.UNIQUE_CONSTRAINT.equals(e.code())) throw e;
        throw duplicate(name, e);
      }
      log.info("strata.collection create project={} name={} id={} fields={}", projectId, name, id, spec.fields().size());
      return byId(db, projectId, id);
    });
  }

  /** Null when no collection matches. */
  public Collection getByNameOrId(String projectId, String nameOrId) {
    Objects.requireNonNull(nameOrId, "nameOrId");
    return retry.run(() -> resolve(router.project(projectId), projectId, nameOrId));
  }

  /** Newest first. */
  public List<Collection> listForProject(String projectId) {
    return retry.run(() -> {
      List<Collection> out = new ArrayList<>();
      for (Row r : router.project(projectId).query(
          "SELECT * FROM collections WHERE project_id = ? ORDER BY created_at DESC, rowid DESC", projectId)) {
        out.add(map(r));
      }
      return out;
    });
  }

  /** Applies the non-null parts of {@code update}; null when the collection does not exist. */
  public Collection update(String projectId, String nameOrId, CollectionUpdate update, String updatedBy) {
    Objects.requireNonNull(update, "update");
    return retry.run(() -> {
      SqlExecutor db = router.project(projectId);
      Collection existing = resolve(db, projectId, nameOrId);
      if (existing == null) return null;
      if (update.isEmpty()) return existing;

      List<FieldDef> fields = update.fields() == null ? existing.fields() : update.fields();
      List<IndexDef> indexes = update.indexes() == null ? existing.indexes() : update.indexes();
      if (update.fields() != null) SchemaValidator.validate(fields).orThrow();
      SchemaValidator.validateIndexes(indexes, fields).orThrow();

      List<String> sets = new ArrayList<>();
      List<Object> params = new ArrayList<>();
      Map<String, Object> changes = new LinkedHashMap<>();
      if (update.description() != null) {
        sets.add("description = ?");
        params.add(update.description());
        changes.put("description", update.description());
      }
      if (update.fields() != null) {
        sets.add("fields = ?");
        params.add(Json.write(update.fields()));
        changes.put("fields", update.fields().size());
      }
      if (update.indexes() != null) {
        sets.add("indexes = ?");
        params.add(Json.write(update.indexes()));
        changes.put("indexes", update.indexes().size());
      }
      sets.add("updated_at = CURRENT_TIMESTAMP");
      params.add(existing.id());

      router.transaction(DatabaseTarget.project(projectId), tx -> {
        tx.execute("UPDATE collections SET " + String.join(", ", sets) + " WHERE id = ?", params.toArray());
        changelog.record(tx, projectId, existing.id(), ChangelogService.COLLECTION, existing.id(),
            ChangelogService.UPDATE, changes, updatedBy);
        return null;
      });
      log.info("strata.collection update project={} name={} changed={}", projectId, existing.name(), changes.keySet());
      return byId(db, projectId, existing.id());
    });
  }

  /**
   * Removes an empty collection.\n
   *
   * @return false when the collection does not exist
   * @throws ConflictException ({@link ConflictException#COLLECTION_HAS_DOCUMENTS}) while documents remain
   */
  public boolean delete(String projectId, String nameOrId, String deletedBy) {
    return retry.run(() -> {
      SqlExecutor db = router.project(projectId);
      Collection existing = resolve(db, projectId, nameOrId);
      if (existing == null) return false;

      long removed = router.transaction(DatabaseTarget.project(projectId), tx -> {
        long n = tx.execute("DELETE FROM collections WHERE id = ? AND NOT EXISTS "
            + "(SELECT 1 FROM documents WHERE collection_id = ? AND is_deleted = 0)", existing.id(), existing.id()).changed();
        if (n == 0) {
          long docs = tx.queryOne("SELECT count(*) AS n FROM documents WHERE collection_id = ? AND is_deleted = 0",
              existing.id()).longValue("n", 0);
          if (docs > 0) {
            log.debug("strata.collection delete_blocked project={} name={} documents={}", projectId, existing.name(), docs);
            throw new ConflictException(ConflictException.COLLECTION_HAS_DOCUMENTS,
                "Collection '" + existing.name() + "' still contains " + docs + " document(s)");
          }
          return 0L;
        }
        changelog.record(tx, projectId, existing.id(), ChangelogService.COLLECTION, existing.id(),
            ChangelogService.DELETE, Map.of("name", existing.name()), deletedBy);
        return n;
      });
      log.info("strata.collection delete project={} name={} removed={}", projectId, existing.name(), removed);
      return removed > 0;
    });
  }

  private Collection resolve(SqlExecutor db, String projectId, String nameOrId) {
    if (Identifiers.isUuid(nameOrId)) {
      return byId(db, projectId, nameOrId);
    }

    String name = decode(nameOrId).trim();
    Row exact = db.queryOne("SELECT * FROM collections WHERE project_id = ? AND name = ?", projectId, name);
    if (exact != null) return map(exact);

    List<String> matches = new ArrayList<>();
    for (Row r : db.query("SELECT name FROM collections WHERE project_id = ? ORDER BY rowid",
        projectId)) {
      String candidate = r.string("name");
      if (candidate != null && candidate.equalsIgnoreCase(name)) matches.add(candidate);
    }
    if (matches.isEmpty()) return null;
    if (matches.size() > 1) {
      log.warn("strata.collection ambiguous_lookup project={} key={} matches={} chosen={}",
          projectId, name, matches, matches.get(0));
    } else {
      log.debug("strata.collection case_insensitive_match project={} key={} name={}", projectId, name, matches.get(0));
    }
    Row canonical = db.queryOne("SELECT * FROM collections WHERE project_id = ? AND name = ?", projectId, matches.get(0));
    return canonical == null ? null : map(canonical);
  }

  private static Collection byId(SqlExecutor db, String projectId, String id) {
    Row r = db.queryOne("SELECT * FROM collections WHERE id = ? AND project_id = ?", id, projectId);
    return r == null ? null : map(r);
  }

  static String decode(String key) {
    try {
      // '+' is a literal in collection keys, not an encoded space
      return URLDecoder.decode(key.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      log.debug("strata.collection undecodable_key key={} error={}", key, e.getMessage());
      return key;
    }
  }

  private static ConflictException duplicate(String name, Throwable cause) {
    String msg = "Collection with this name already exists in this project: " + name;
    return cause == null
        ? new ConflictException(ConflictException.DUPLICATE_COLLECTION_NAME, msg)
        : new ConflictException(ConflictException.DUPLICATE_COLLECTION_NAME, msg, cause);
  }

  static Collection map(Row r) {
    return new Collection(
        r.string("id"),
        r.string("project_id"),
        r.string("name"),
        r.string("description"),
        Json.read(r.string("fields"), FIELDS, List.of()),
        Json.read(r.string("indexes"), INDEXES, List.of()),
        r.string("created_by"),
        r.string("created_at"),
        r.string("updated_at"));
  }
}
