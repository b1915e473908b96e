package io.intellixity.strata.schema;

import java.util.List;
import java.util.Objects;

/** Declared index over one or more fields of a collection. */
public record IndexDef(String name, List<String> fields, boolean unique) {
  public IndexDef {
    Objects.requireNonNull(name, "name");
    fields = fields == null ? List.of() : List.copyOf(fields);
  }
}
