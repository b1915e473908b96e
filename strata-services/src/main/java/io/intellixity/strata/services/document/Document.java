package io.intellixity.strata.services.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A stored document: the JSON payload plus bookkeeping columns. */
public record Document(String id,
                       String collectionId,
                       String projectId,
                       Map<String, Object> data,
                       long version,
                       String createdBy,
                       String updatedBy,
                       String createdAt,
                       String updatedAt) {
  public Document {
    Objects.requireNonNull(id, "id");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  public Object get(String field) { return data.get(field); }
}
