package io.intellixity.strata.services.collection;

import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.IndexDef;

import java.util.List;

/** Partial update; null components are left unchanged. */
public record CollectionUpdate(String description, List<FieldDef> fields, List<IndexDef> indexes) {
  public boolean isEmpty() { return description == null && fields == null && indexes == null; }

  public static CollectionUpdate description(String description) { return new CollectionUpdate(description, null, null); }

  public static CollectionUpdate fields(List<FieldDef> fields) { return new CollectionUpdate(null, fields, null); }
}
