package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;

/** OpenAPI nullable marker: {@code x-nullable: true} (Swagger 2) or a truthy {@code nullable} (OpenAPI 3). */
public final class Nullability {
  private Nullability() {}

  public static boolean isNullable(JsonNode schema) {
    if (schema == null || !schema.isObject()) return false;
    return isTrue(schema.get("x-nullable")) || isTruthy(schema.get("nullable"));
  }

  /** A null instance under a nullable schema passes regardless of the other keywords. */
  public static boolean allowsNull(JsonNode instance, JsonNode schema) {
    return instance != null && instance.isNull() && isNullable(schema);
  }

  static boolean isTrue(JsonNode value) {
    return value != null && value.isBoolean() && value.booleanValue();
  }

  /** false, 0, "", [], {} and null are falsy; absent counts as false. */
  static boolean isTruthy(JsonNode value) {
    if (value == null || value.isNull() || value.isMissingNode()) return false;
    if (value.isBoolean()) return value.booleanValue();
    if (value.isNumber()) return value.decimalValue().signum() != 0;
    if (value.isTextual()) return !value.textValue().isEmpty();
    if (value.isContainerNode()) return value.size() > 0;
    return true;
  }
}
