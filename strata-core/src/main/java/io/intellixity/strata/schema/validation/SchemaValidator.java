package io.intellixity.strata.schema.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.FieldType;
import io.intellixity.strata.schema.FieldValidation;
import io.intellixity.strata.schema.Identifiers;
import io.intellixity.strata.schema.IndexDef;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates a collection's field list at create/update time.\n
 *
 * The {@link JsonNode} entry point accepts raw request bodies so that shape errors (not an array,
 * unknown type strings) are reported instead of failing deserialization.\n
 */
public final class SchemaValidator {
  private SchemaValidator() {}

  public static ValidationResult validate(JsonNode fields) {
    if (fields == null || !fields.isArray()) return ValidationResult.fail("Fields must be an array");

    Set<String> names = new HashSet<>();
    for (JsonNode f : fields) {
      String name = text(f, "name");
      String type = text(f, "type");
      if (name == null || name.isEmpty() || type == null || type.isEmpty()) {
        return ValidationResult.fail("Each field must have a name and type");
      }
      ValidationResult r = checkName(name, names);
      if (!r.valid()) return r;

      FieldType ft = FieldType.fromWire(type).orElse(null);
      if (ft == null) return ValidationResult.fail("Invalid field type: " + type);

      JsonNode v = f.get("validation");
      if (v != null && v.isObject()) {
        FieldValidation fv = new FieldValidation(
            intOrNull(v, "minLength"), intOrNull(v, "maxLength"),
            doubleOrNull(v, "min"), doubleOrNull(v, "max"),
            intOrNull(v, "minItems"), intOrNull(v, "maxItems"),
            text(v, "pattern"));
        r = checkConstraints(name, ft, fv);
        if (!r.valid()) return r;
      }
    }
    return ValidationResult.ok();
  }

  public static ValidationResult validate(List<FieldDef> fields) {
    if (fields == null) return ValidationResult.fail("Fields must be an array");
    Set<String> names = new HashSet<>();
    for (FieldDef f : fields) {
      if (f == null || f.name().isEmpty()) return ValidationResult.fail("Each field must have a name and type");
      ValidationResult r = checkName(f.name(), names);
      if (!r.valid()) return r;
      if (f.validation() != null) {
        r = checkConstraints(f.name(), f.type(), f.validation());
        if (!r.valid()) return r;
      }
    }
    return ValidationResult.ok();
  }

  /** Index names must be unique and every indexed field must be declared. */
  public static ValidationResult validateIndexes(List<IndexDef> indexes, List<FieldDef> fields) {
    if (indexes == null || indexes.isEmpty()) return ValidationResult.ok();
    Set<String> declared = new HashSet<>();
    if (fields != null) for (FieldDef f : fields) declared.add(f.name());

    Set<String> seen = new HashSet<>();
    for (IndexDef idx : indexes) {
      if (idx.name().isBlank()) return ValidationResult.fail("Index name cannot be empty");
      if (!seen.add(idx.name())) return ValidationResult.fail("Duplicate index name: " + idx.name());
      if (idx.fields().isEmpty()) return ValidationResult.fail("Index " + idx.name() + ": must reference at least one field");
      for (String field : idx.fields()) {
        if (!declared.contains(field)) {
          return ValidationResult.fail("Index " + idx.name() + ": unknown field " + field);
        }
      }
    }
    return ValidationResult.ok();
  }

  private static ValidationResult checkName(String name, Set<String> seen) {
    if (!seen.add(name)) return ValidationResult.fail("Duplicate field name: " + name);
    if (!Identifiers.isName(name)) {
      return ValidationResult.fail("Invalid field name: " + name + ". Use only letters, numbers, and underscores.");
    }
    return ValidationResult.ok();
  }

  private static ValidationResult checkConstraints(String field, FieldType type, FieldValidation v) {
    String err = switch (type.kind()) {
      case STRING, EMAIL, URL, UUID -> lengthError(v);
      case NUMBER, INTEGER -> rangeError(v);
      case ARRAY -> itemsError(v);
      case BOOLEAN, DATE, OBJECT, ANY -> null;
    };
    if (err == null && v.pattern() != null) err = patternError(v.pattern());
    return err == null ? ValidationResult.ok() : ValidationResult.fail("Field " + field + ": " + err);
  }

  private static String lengthError(FieldValidation v) {
    if (v.minLength() != null && v.minLength() < 0) return "minLength must be non-negative";
    if (v.maxLength() != null && v.maxLength() < 0) return "maxLength must be non-negative";
    if (v.minLength() != null && v.maxLength() != null && v.minLength() > v.maxLength()) {
      return "minLength cannot be greater than maxLength";
    }
    return null;
  }

  private static String rangeError(FieldValidation v) {
    if (v.min() != null && v.max() != null && v.min() > v.max()) return "min cannot be greater than max";
    return null;
  }

  private static String itemsError(FieldValidation v) {
    if (v.minItems() != null && v.minItems() < 0) return "minItems must be non-negative";
    if (v.maxItems() != null && v.maxItems() < 0) return "maxItems must be non-negative";
    if (v.minItems() != null && v.maxItems() != null && v.minItems() > v.maxItems()) {
      return "minItems cannot be greater than maxItems";
    }
    return null;
  }

  private static String patternError(String pattern) {
    try {
      Pattern.compile(pattern);
      return null;
    } catch (PatternSyntaxException e) {
      return "invalid pattern";
    }
  }

  private static String text(JsonNode n, String field) {
    JsonNode v = n == null ? null : n.get(field);
    return (v == null || !v.isTextual()) ? null : v.asText();
  }

  private static Integer intOrNull(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || !v.isNumber()) ? null : v.asInt();
  }

  private static Double doubleOrNull(JsonNode n, String field) {
    JsonNode v = n.get(field);
    return (v == null || !v.isNumber()) ? null : v.asDouble();
  }
}
