package io.intellixity.strata.services.collection;

import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.IndexDef;

import java.util.List;

/** Input to {@link CollectionService#create}. */
public record CollectionSpec(String description, List<FieldDef> fields, List<IndexDef> indexes) {
  public CollectionSpec {
    fields = fields == null ? List.of() : List.copyOf(fields);
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
  }

  public static CollectionSpec of(List<FieldDef> fields) {
    return new CollectionSpec(null, fields, List.of());
  }
}
