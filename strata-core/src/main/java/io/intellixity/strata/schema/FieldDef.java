package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One declared attribute of a collection.\n
 *
 * {@code unique} and {@code indexed} are storage hints; they are not enforced by document validation.\n
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldDef(String name,
                       FieldType type,
                       boolean required,
                       boolean unique,
                       boolean indexed,
                       @JsonProperty("default") Object defaultValue,
                       FieldValidation validation,
                       String description) {

  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static FieldDef of(String name, FieldType type) {
    return new FieldDef(name, type, false, false, false, null, null, null);
  }

  public static FieldDef required(String name, FieldType type) {
    return new FieldDef(name, type, true, false, false, null, null, null);
  }

  public FieldDef withValidation(FieldValidation v) {
    return new FieldDef(name, type, required, unique, indexed, defaultValue, v, description);
  }

  public FieldDef withDefault(Object v) {
    return new FieldDef(name, type, required, unique, indexed, v, validation, description);
  }

  public FieldDef asUnique() {
    return new FieldDef(name, type, required, true, true, defaultValue, validation, description);
  }
}
