package io.intellixity.strata.services.document;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Paging, ordering and equality filter for {@link DocumentService#list}.\n
 *
 * {@code orderBy} is a bookkeeping column ({@code created_at}, {@code updated_at}, {@code id}) or a top-level
 * data field; {@code where} matches top-level data fields by equality.\n
 */
public record DocumentQuery(int limit, int offset, String orderBy, boolean descending, Map<String, Object> where) {
  public static final int DEFAULT_LIMIT = 100;
  public static final int MAX_LIMIT = 1000;

  public DocumentQuery {
    if (limit <= 0) limit = DEFAULT_LIMIT;
    if (limit > MAX_LIMIT) limit = MAX_LIMIT;
    if (offset < 0) offset = 0;
    if (orderBy == null || orderBy.isBlank()) orderBy = "created_at";
    where = where == null ? Map.of() : new LinkedHashMap<>(where);
  }

  public static DocumentQuery firstPage() {
    return new DocumentQuery(DEFAULT_LIMIT, 0, "created_at", true, Map.of());
  }

  public static DocumentQuery page(int limit, int offset) {
    return new DocumentQuery(limit, offset, "created_at", true, Map.of());
  }

  public DocumentQuery orderBy(String field, boolean desc) {
    return new DocumentQuery(limit, offset, field, desc, where);
  }

  public DocumentQuery where(String field, Object value) {
    Map<String, Object> w = new LinkedHashMap<>(where);
    w.put(field, value);
    return new DocumentQuery(limit, offset, orderBy, descending, w);
  }
}
