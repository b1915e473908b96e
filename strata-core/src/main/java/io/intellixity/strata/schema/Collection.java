package io.intellixity.strata.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A runtime-declared collection stored in its project's database. */
public record Collection(String id,
                         String projectId,
                         String name,
                         String description,
                         List<FieldDef> fields,
                         List<IndexDef> indexes,
                         String createdBy,
                         String createdAt,
                         String updatedAt) {

  public Collection {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(projectId, "projectId");
    Objects.requireNonNull(name, "name");
    fields = fields == null ? List.of() : List.copyOf(fields);
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
  }

  public Optional<FieldDef> field(String fieldName) {
    for (FieldDef f : fields) {
      if (f.name().equals(fieldName)) return Optional.of(f);
    }
    return Optional.empty();
  }
}
