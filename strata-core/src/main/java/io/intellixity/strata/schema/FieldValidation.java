package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Optional per-field constraints. Unset bounds are null. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FieldValidation(Integer minLength,
                              Integer maxLength,
                              Double min,
                              Double max,
                              Integer minItems,
                              Integer maxItems,
                              String pattern) {

  public static FieldValidation none() {
    return new FieldValidation(null, null, null, null, null, null, null);
  }

  public static FieldValidation length(Integer minLength, Integer maxLength) {
    return new FieldValidation(minLength, maxLength, null, null, null, null, null);
  }

  public static FieldValidation range(Double min, Double max) {
    return new FieldValidation(null, null, min, max, null, null, null);
  }

  public static FieldValidation items(Integer minItems, Integer maxItems) {
    return new FieldValidation(null, null, null, null, minItems, maxItems, null);
  }

  public static FieldValidation pattern(String pattern) {
    return new FieldValidation(null, null, null, null, null, null, pattern);
  }
}
