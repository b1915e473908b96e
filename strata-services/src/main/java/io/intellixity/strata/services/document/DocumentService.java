package io.intellixity.strata.services.document;

import io.intellixity.strata.error.NotFoundException;
import io.intellixity.strata.error.ValidationException;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.QueryRouter;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import io.intellixity.strata.schema.Collection;
import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.Identifiers;
import io.intellixity.strata.schema.validation.DocumentValidator;
import io.intellixity.strata.schema.validation.ValidationResult;
import io.intellixity.strata.services.DriftRetry;
import io.intellixity.strata.services.changelog.ChangelogService;
import io.intellixity.strata.services.collection.CollectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Document CRUD inside a project's database.\n
 *
 * Writes validate against the owning collection's fields before anything is stored; a write and its
 * changelog entry share one transaction.\n
 */
public final class DocumentService {
  private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

  private static final Set<String> COLUMN_ORDER = Set.of("created_at", "updated_at", "id", "version");
  private static final String SYSTEM_USER = "system";

  private final QueryRouter router;
  private final CollectionService collections;
  private final ChangelogService changelog;
  private final DriftRetry retry;

  public DocumentService(QueryRouter router, CollectionService collections, ChangelogService changelog, DriftRetry retry) {
    this.router = Objects.requireNonNull(router, "router");
    this.collections = Objects.requireNonNull(collections, "collections");
    this.changelog = Objects.requireNonNull(changelog, "changelog");
    this.retry = Objects.requireNonNull(retry, "retry");
  }

  public Document create(String projectId, String collection, Map<String, ?> data, String createdBy) {
    Collection c = require(projectId, collection);
    Map<String, Object> payload = withDefaults(c.fields(), data);
    DocumentValidator.validate(payload, c.fields()).orThrow();
    String user = createdBy == null ? SYSTEM_USER : createdBy;

    return retry.run(() -> {
      String id = UUID.randomUUID().toString();
      router.transaction(DatabaseTarget.project(projectId), tx -> {
        insert(tx, c, id, payload, user);
        changelog.record(tx, projectId, c.id(), ChangelogService.DOCUMENT, id, ChangelogService.CREATE,
            Map.of("fields", new ArrayList<>(payload.keySet())), user);
        return null;
      });
      log.debug("strata.document create project={} collection={} id={}", projectId, c.name(), id);
      return byId(router.project(projectId), c.id(), id);
    });
  }

  /** Validates every item; valid items are inserted in one transaction, invalid ones are reported by index. */
  public BatchResult createBatch(String projectId, String collection, List<? extends Map<String, ?>> items, String createdBy) {
    Objects.requireNonNull(items, "items");
    Collection c = require(projectId, collection);
    String user = createdBy == null ? SYSTEM_USER : createdBy;

    List<Map<String, Object>> valid = new ArrayList<>();
    List<BatchResult.ItemError> errors = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      Map<String, Object> payload = withDefaults(c.fields(), items.get(i));
      ValidationResult r = DocumentValidator.validate(payload, c.fields());
      if (r.valid()) valid.add(payload);
      else errors.add(new BatchResult.ItemError(i, r.error()));
    }
    if (valid.isEmpty()) return new BatchResult(List.of(), errors);

    return retry.run(() -> {
      List<String> ids = router.transaction(DatabaseTarget.project(projectId), tx -> {
        List<String> out = new ArrayList<>(valid.size());
        for (Map<String, Object> payload : valid) {
          String id = UUID.randomUUID().toString();
          insert(tx, c, id, payload, user);
          changelog.record(tx, projectId, c.id(), ChangelogService.DOCUMENT, id, ChangelogService.CREATE,
              Map.of("batch", true), user);
          out.add(id);
        }
        return out;
      });
      SqlExecutor db = router.project(projectId);
      List<Document> created = new ArrayList<>(ids.size());
      for (String id : ids) created.add(byId(db, c.id(), id));
      log.info("strata.document create_batch project={} collection={} created={} rejected={}",
          projectId, c.name(), created.size(), errors.size());
      return new BatchResult(created, errors);
    });
  }

  /** Null when the collection or document does not exist (soft-deleted documents are invisible). */
  public Document get(String projectId, String collection, String documentId) {
    Collection c = collections.getByNameOrId(projectId, collection);
    if (c == null) return null;
    return retry.run(() -> byId(router.project(projectId), c.id(), documentId));
  }

  public DocumentPage list(String projectId, String collection, DocumentQuery query) {
    DocumentQuery q = query == null ? DocumentQuery.firstPage() : query;
    Collection c = collections.getByNameOrId(projectId, collection);
    if (c == null) return DocumentPage.empty();

    StringBuilder where = new StringBuilder("WHERE collection_id = ? AND is_deleted = 0");
    List<Object> params = new ArrayList<>();
    params.add(c.id());
    for (Map.Entry<String, Object> e : q.where().entrySet()) {
      where.append(" AND json_extract(data, ?) = ?");
      params.add(jsonPath(e.getKey()));
      params.add(e.getValue());
    }
    String order = COLUMN_ORDER.contains(q.orderBy())
        ? q.orderBy()
        : "json_extract(data, '" + jsonPath(q.orderBy()) + "')";
    String dir = q.descending() ? "DESC" : "ASC";

    return retry.run(() -> {
      SqlExecutor db = router.project(projectId);
      long total = db.queryOne("SELECT count(*) AS n FROM documents " + where, params.toArray()).longValue("n", 0);
      List<Object> paged = new ArrayList<>(params);
      paged.add(q.limit());
      paged.add(q.offset());
      List<Document> docs = new ArrayList<>();
      for (Row r : db.query("SELECT * FROM documents " + where + " ORDER BY " + order + " " + dir + ", rowid " + dir
          + " LIMIT ? OFFSET ?", paged.toArray())) {
        docs.add(map(r));
      }
      return new DocumentPage(docs, total);
    });
  }

  /** Merges {@code patch} over the stored data, re-validates and bumps the version; null when absent. */
  public Document update(String projectId, String collection, String documentId, Map<String, ?> patch, String updatedBy) {
    Objects.requireNonNull(patch, "patch");
    Collection c = require(projectId, collection);
    String user = updatedBy == null ? SYSTEM_USER : updatedBy;

    return retry.run(() -> {
      SqlExecutor db = router.project(projectId);
      Document existing = byId(db, c.id(), documentId);
      if (existing == null) return null;

      Map<String, Object> merged = new LinkedHashMap<>(existing.data());
      merged.putAll(patch);
      DocumentValidator.validate(merged, c.fields()).orThrow();

      router.transaction(DatabaseTarget.project(projectId), tx -> {
        tx.execute("UPDATE documents SET data = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP, "
            + "updated_by = ? WHERE id = ? AND collection_id = ?", merged, user, documentId, c.id());
        changelog.record(tx, projectId, c.id(), ChangelogService.DOCUMENT, documentId, ChangelogService.UPDATE,
            Map.of("fields", new ArrayList<>(patch.keySet())), user);
        return null;
      });
      return byId(db, c.id(), documentId);
    });
  }

  public boolean delete(String projectId, String collection, String documentId, String deletedBy) {
    Collection c = collections.getByNameOrId(projectId, collection);
    if (c == null) return false;
    return retry.run(() -> router.transaction(DatabaseTarget.project(projectId), tx -> {
      long n = tx.execute("DELETE FROM documents WHERE id = ? AND collection_id = ?", documentId, c.id()).changed();
      if (n > 0) {
        changelog.record(tx, projectId, c.id(), ChangelogService.DOCUMENT, documentId, ChangelogService.DELETE,
            Map.of(), deletedBy);
      }
      return n > 0;
    }));
  }

  /** Hard-deletes every document of the collection; returns how many were removed. */
  public long deleteAll(String projectId, String collection, String deletedBy) {
    Collection c = require(projectId, collection);
    long removed = retry.run(() -> router.transaction(DatabaseTarget.project(projectId), tx -> {
      long n = tx.execute("DELETE FROM documents WHERE collection_id = ?", c.id()).changed();
      changelog.record(tx, projectId, c.id(), ChangelogService.COLLECTION, c.id(), ChangelogService.PURGE,
          Map.of("documents", n), deletedBy);
      return n;
    }));
    log.info("strata.document delete_all project={} collection={} removed={}", projectId, c.name(), removed);
    return removed;
  }

  public long count(String projectId, String collection) {
    Collection c = collections.getByNameOrId(projectId, collection);
    if (c == null) return 0;
    return retry.run(() -> router.project(projectId).queryOne(
        "SELECT count(*) AS n FROM documents WHERE collection_id = ? AND is_deleted = 0", c.id()).longValue("n", 0));
  }

  private Collection require(String projectId, String collection) {
    Collection c = collections.getByNameOrId(projectId, collection);
    if (c == null) {
      throw new NotFoundException("Collection '" + collection + "' not found in project '" + projectId + "'");
    }
    return c;
  }

  private static void insert(SqlExecutor tx, Collection c, String id, Map<String, Object> payload, String user) {
    tx.execute("INSERT INTO documents (id, collection_id, project_id, data, created_by, updated_by) "
        + "VALUES (?, ?, ?, ?, ?, ?)", id, c.id(), c.projectId(), payload, user, user);
  }

  private static Map<String, Object> withDefaults(List<FieldDef> fields, Map<String, ?> data) {
    Map<String, Object> out = new LinkedHashMap<>();
    if (data != null) out.putAll(data);
    for (FieldDef f : fields) {
      if (f.defaultValue() != null && !out.containsKey(f.name())) out.put(f.name(), f.defaultValue());
    }
    return out;
  }

  private static String jsonPath(String field) {
    if (!Identifiers.isName(field)) throw new ValidationException("Invalid field name: " + field);
    return "$." + field;
  }

  private static Document byId(SqlExecutor db, String collectionId, String id) {
    Row r = db.queryOne("SELECT * FROM documents WHERE id = ? AND collection_id = ? AND is_deleted = 0", id, collectionId);
    return r == null ? null : map(r);
  }

  private static Document map(Row r) {
    return new Document(
        r.string("id"),
        r.string("collection_id"),
        r.string("project_id"),
        r.jsonMap("data"),
        r.longValue("version", 1),
        r.string("created_by"),
        r.string("updated_by"),
        r.string("created_at"),
        r.string("updated_at"));
  }
}
