package io.intellixity.strata.schema.validation;

import io.intellixity.strata.error.ValidationException;
import io.intellixity.strata.json.Json;
import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.FieldType;
import io.intellixity.strata.schema.FieldValidation;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class DocumentValidatorTest {
  private static final List<FieldDef> AGE = List.of(
      FieldDef.required("age", FieldType.NUMBER).withValidation(FieldValidation.range(0.0, 120.0)));

  @Test
  void requiredBoundedNumber() {
    ValidationResult missing = DocumentValidator.validate(Map.of(), AGE);
    assertFalse(missing.valid());
    assertEquals("Missing required field: age", missing.error());

    ValidationResult tooOld = DocumentValidator.validate(Map.of("age", 150), AGE);
    assertFalse(tooOld.valid());
    assertEquals("Field age must be at most 120", tooOld.error());

    assertTrue(DocumentValidator.validate(Map.of("age", 30), AGE).valid());
  }

  @Test
  void requiredFieldsAreCheckedBeforeTypes() {
    List<FieldDef> fields = List.of(
        FieldDef.of("name", FieldType.STRING),
        FieldDef.required("email", FieldType.STRING));
    ValidationResult r = DocumentValidator.validate(Map.of("name", 42), fields);
    assertEquals("Missing required field: email", r.error());
  }

  @Test
  void firstFailingFieldWins() {
    List<FieldDef> fields = List.of(
        FieldDef.of("a", FieldType.BOOLEAN),
        FieldDef.of("b", FieldType.OBJECT));
    ValidationResult r = DocumentValidator.validate(Map.of("a", "yes", "b", "no"), fields);
    assertEquals("Field a must be a boolean", r.error());
  }

  @Test
  void stringConstraints() {
    List<FieldDef> fields = List.of(FieldDef.of("code", FieldType.STRING)
        .withValidation(new FieldValidation(2, 4, null, null, null, null, "^[A-Z]+$")));
    assertEquals("Field code must be at least 2 characters", DocumentValidator.validate(Map.of("code", "A"), fields).error());
    assertEquals("Field code must be at most 4 characters", DocumentValidator.validate(Map.of("code", "ABCDE"), fields).error());
    assertEquals("Field code does not match the required pattern", DocumentValidator.validate(Map.of("code", "ab"), fields).error());
    assertEquals("Field code must be a string", DocumentValidator.validate(Map.of("code", 12), fields).error());
    assertTrue(DocumentValidator.validate(Map.of("code", "ABC"), fields).valid());
  }

  @Test
  void numbersMustBeFinite() {
    List<FieldDef> fields = List.of(FieldDef.of("x", FieldType.NUMBER));
    assertEquals("Field x must be a number", DocumentValidator.validate(Map.of("x", Double.NaN), fields).error());
    assertEquals("Field x must be a number", DocumentValidator.validate(Map.of("x", "1"), fields).error());
    assertTrue(DocumentValidator.validate(Map.of("x", 1.5), fields).valid());
  }

  @Test
  void datesArraysAndObjects() {
    List<FieldDef> fields = List.of(
        FieldDef.of("at", FieldType.DATE),
        FieldDef.of("tags", FieldType.ARRAY).withValidation(FieldValidation.items(1, 2)),
        FieldDef.of("meta", FieldType.OBJECT));

    assertTrue(DocumentValidator.validate(Map.of("at", "2024-03-01"), fields).valid());
    assertTrue(DocumentValidator.validate(Map.of("at", "2024-03-01T10:15:30Z"), fields).valid());
    assertTrue(DocumentValidator.validate(Map.of("at", "2024-03-01 10:15:30"), fields).valid());
    assertEquals("Field at must be a valid date string", DocumentValidator.validate(Map.of("at", "yesterday"), fields).error());

    assertEquals("Field tags must have at least 1 items", DocumentValidator.validate(Map.of("tags", List.of()), fields).error());
    assertEquals("Field tags must have at most 2 items", DocumentValidator.validate(Map.of("tags", List.of(1, 2, 3)), fields).error());
    assertEquals("Field tags must be an array", DocumentValidator.validate(Map.of("tags", "a"), fields).error());

    assertEquals("Field meta must be an object", DocumentValidator.validate(Map.of("meta", List.of()), fields).error());
    Map<String, Object> nullMeta = new HashMap<>();
    nullMeta.put("meta", null);
    assertEquals("Field meta must be an object", DocumentValidator.validate(nullMeta, fields).error());
  }

  @Test
  void undeclaredKeysAreAllowed_andUniqueIsNotChecked() {
    List<FieldDef> fields = List.of(FieldDef.of("email", FieldType.STRING).asUnique());
    assertTrue(DocumentValidator.validate(Map.of("email", "a@b.c", "extra", true), fields).valid());
  }

  @Test
  void extendedKinds() {
    List<FieldDef> fields = List.of(
        FieldDef.of("n", FieldType.INTEGER),
        FieldDef.of("mail", FieldType.EMAIL),
        FieldDef.of("site", FieldType.URL),
        FieldDef.of("blob", FieldType.JSON));
    assertEquals("Field n must be an integer", DocumentValidator.validate(Map.of("n", 1.5), fields).error());
    assertEquals("Field mail must be a valid email address", DocumentValidator.validate(Map.of("mail", "nope"), fields).error());
    assertEquals("Field site must be a valid URL", DocumentValidator.validate(Map.of("site", "ftp://x"), fields).error());
    assertTrue(DocumentValidator.validate(Map.of("n", 3, "mail", "a@b.io", "site", "https://x.io/a", "blob", List.of()), fields).valid());
  }

  @Test
  void jsonPayloadAndOrThrow() {
    ValidationResult r = DocumentValidator.validate(Json.tree("{\"age\": 121}"), AGE);
    ValidationException ex = assertThrows(ValidationException.class, r::orThrow);
    assertTrue(ex.getMessage().contains("at most 120"));
  }
}
