package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpenApiKeywordsTest {

  private static final ObjectMapper OM = new ObjectMapper();

  @Nested
  class Nullable {

    @Test
    @DisplayName("null passes a nullable type in both modes")
    void nullPassesNullableType() {
      JsonNode schema = json("{\"type\": \"string\", \"nullable\": true}");

      assertThat(OpenApiValidators.forRequest(schema).validate(json("null"))).isEmpty();
      assertThat(OpenApiValidators.forResponse(schema).validate(json("null"))).isEmpty();
    }

    @Test
    @DisplayName("non-null of the wrong type still fails exactly once")
    void wrongTypeStillFails() {
      List<ValidationError> errors = OpenApiValidators.forRequest(json("{\"type\": \"string\", \"nullable\": true}"))
          .validate(json("42"));

      assertThat(errors).hasSize(1);
      assertThat(errors.get(0).keyword()).isEqualTo("type");
      assertThat(errors.get(0).schemaPath()).containsExactly("type");
    }

    @Test
    @DisplayName("x-nullable must be exactly true")
    void xNullableIsStrict() {
      assertThat(OpenApiValidators.forRequest(json("{\"type\": \"integer\", \"x-nullable\": true}")).validate(json("null"))).isEmpty();
      assertThat(OpenApiValidators.forRequest(json("{\"type\": \"integer\", \"x-nullable\": \"yes\"}")).validate(json("null"))).hasSize(1);
    }

    @Test
    @DisplayName("null bypasses enum, oneOf and (response) properties")
    void nullBypassesOtherKeywords() {
      assertThat(OpenApiValidators.forRequest(json("{\"enum\": [\"a\", \"b\"], \"nullable\": true}")).validate(json("null"))).isEmpty();
      assertThat(OpenApiValidators.forRequest(json("{\"oneOf\": [{\"type\": \"string\"}], \"nullable\": true}")).validate(json("null"))).isEmpty();
      assertThat(OpenApiValidators.forResponse(json("{\"properties\": {\"a\": {\"type\": \"string\"}}, \"x-nullable\": true}"))
          .validate(json("null"))).isEmpty();
    }

    @Test
    void enumWithoutNullableRejectsNull() {
      List<ValidationError> errors = OpenApiValidators.forRequest(json("{\"enum\": [\"a\", \"b\"]}")).validate(json("null"));

      assertThat(errors).extracting(ValidationError::keyword).containsExactly("enum");
    }
  }

  @Nested
  class OneOf {
    private final JsonNode stringOrNumber = json("{\"oneOf\": [{\"type\": \"string\"}, {\"type\": \"number\"}]}");

    @Test
    void exactlyOneMatchPasses() {
      assertThat(OpenApiValidators.forRequest(stringOrNumber).validate(json("\"x\""))).isEmpty();
      assertThat(OpenApiValidators.forRequest(stringOrNumber).validate(json("5"))).isEmpty();
    }

    @Test
    @DisplayName("no match fails with every branch error as context")
    void noMatchCarriesContext() {
      List<ValidationError> errors = OpenApiValidators.forResponse(stringOrNumber).validate(json("true"));

      assertThat(errors).hasSize(1);
      ValidationError error = errors.get(0);
      assertThat(error.message()).isEqualTo("true is not valid under any of the given schemas");
      assertThat(error.schemaPath()).containsExactly("oneOf");
      assertThat(error.context()).extracting(ValidationError::schemaPath)
          .containsExactlyInAnyOrder(List.of("oneOf", 0, "type"), List.of("oneOf", 1, "type"));
    }

    @Test
    @DisplayName("more than one match fails listing the matching subschemas")
    void twoMatchesFail() {
      List<ValidationError> errors = OpenApiValidators.forRequest(json("{\"oneOf\": [{\"type\": \"string\"}, {}]}"))
          .validate(json("\"x\""));

      assertThat(errors).hasSize(1);
      assertThat(errors.get(0).message()).isEqualTo("\"x\" is valid under each of {\"type\":\"string\"}, {}");
      assertThat(errors.get(0).keyword()).isEqualTo("oneOf");
    }
  }

  @Nested
  class AllOf {
    private final JsonNode schema = json("""
        {"allOf": [{"properties": {"a": {"type": "string"}}}, {"properties": {"a": {"type": "number"}}}]}""");

    @Test
    @DisplayName("later subschema wins on a shared keyword")
    void laterSubschemaWins() {
      SchemaValidator v = OpenApiValidators.forRequest(schema);

      assertThat(v.validate(json("{\"a\": 1}"))).isEmpty();
      List<ValidationError> errors = v.validate(json("{\"a\": \"x\"}"));
      assertThat(errors).hasSize(1);
      assertThat(errors.get(0).path()).containsExactly("a");
      assertThat(errors.get(0).schemaPath()).containsExactly("allOf", 1, "properties", "a", "type");
    }

    @Test
    @DisplayName("keywords from different subschemas all apply")
    void disjointKeywordsCombine() {
      SchemaValidator v = OpenApiValidators.forRequest(json("""
          {"allOf": [{"type": "object", "required": ["id"]}, {"properties": {"id": {"type": "integer"}}}]}"""));

      assertThat(v.validate(json("{\"id\": 3}"))).isEmpty();
      List<ValidationError> missing = v.validate(json("{}"));
      assertThat(missing).extracting(ValidationError::message).containsExactly("'id' is a required property");
      assertThat(missing.get(0).schemaPath()).containsExactly("allOf", 0, "required");
      assertThat(v.validate(json("{\"id\": \"3\"}"))).extracting(ValidationError::keyword).containsExactly("type");
    }

    @Test
    @DisplayName("required inside allOf sees properties merged from a sibling subschema")
    void requiredSeesMergedProperties() {
      SchemaValidator v = OpenApiValidators.forRequest(json("""
          {"allOf": [{"required": ["id"]}, {"properties": {"id": {"type": "string", "readOnly": true}}}]}"""));

      assertThat(v.validate(json("{}"))).isEmpty();
    }
  }

  @Nested
  class ReadAndWriteOnly {
    private final JsonNode schema = json("""
        {"type": "object", "required": ["id", "password"],
         "properties": {"id": {"type": "string", "readOnly": true},
                        "password": {"type": "string", "writeOnly": true},
                        "pin": {"type": "string", "x-writeOnly": true}}}""");

    @Test
    @DisplayName("request may omit a required read-only property")
    void requestToleratesMissingReadOnly() {
      JsonNode s = json("{\"required\": [\"id\"], \"properties\": {\"id\": {\"type\": \"string\", \"readOnly\": true}}}");

      assertThat(OpenApiValidators.forRequest(s).validate(json("{}"))).isEmpty();
      assertThat(OpenApiValidators.forResponse(s).validate(json("{}")))
          .extracting(ValidationError::message).containsExactly("'id' is a required property");
    }

    @Test
    @DisplayName("request must not send a read-only property")
    void requestRejectsReadOnlyValue() {
      List<ValidationError> errors = OpenApiValidators.forRequest(schema).validate(json("{\"id\": \"1\", \"password\": \"p\"}"));

      assertThat(errors).hasSize(1);
      assertThat(errors.get(0).message()).isEqualTo("Property is read-only");
      assertThat(errors.get(0).pointer()).isEqualTo("/id");
      assertThat(errors.get(0).schemaPointer()).isEqualTo("/properties/id/readOnly");
    }

    @Test
    @DisplayName("response may omit a required write-only property")
    void responseToleratesMissingWriteOnly() {
      assertThat(OpenApiValidators.forResponse(schema).validate(json("{\"id\": \"1\"}"))).isEmpty();
      assertThat(OpenApiValidators.forRequest(schema).validate(json("{}")))
          .extracting(ValidationError::message).containsExactly("'password' is a required property");
    }

    @Test
    @DisplayName("response must not echo write-only properties")
    void responseRejectsWriteOnlyValues() {
      List<ValidationError> errors = OpenApiValidators.forResponse(schema)
          .validate(json("{\"id\": \"1\", \"password\": \"p\", \"pin\": \"0000\"}"));

      assertThat(errors).extracting(ValidationError::message).containsOnly("Property is write-only");
      assertThat(errors).extracting(ValidationError::pointer).containsExactlyInAnyOrder("/password", "/pin");
    }

    @Test
    @DisplayName("a marker fires whatever its value once the property is present")
    void markerValueDoesNotMatter() {
      assertThat(OpenApiValidators.forRequest(json("{\"properties\": {\"id\": {\"readOnly\": false}}}"))
          .validate(json("{\"id\": 1}")))
          .extracting(ValidationError::message).containsExactly("Property is read-only");
      assertThat(OpenApiValidators.forResponse(json("{\"properties\": {\"pin\": {\"x-writeOnly\": \"yes\"}}}"))
          .validate(json("{\"pin\": 1}")))
          .extracting(ValidationError::message).containsExactly("Property is write-only");
    }

    @Test
    @DisplayName("markers of the other direction are ignored")
    void otherDirectionIgnored() {
      assertThat(OpenApiValidators.forResponse(schema).validate(json("{\"id\": \"1\"}"))).isEmpty();
      assertThat(OpenApiValidators.forRequest(schema).validate(json("{\"password\": \"p\", \"pin\": \"0\"}"))).isEmpty();
    }

    @Test
    @DisplayName("required ignores non-objects")
    void requiredIgnoresNonObjects() {
      JsonNode s = json("{\"required\": [\"id\"]}");

      assertThat(OpenApiValidators.forResponse(s).validate(json("[1, 2]"))).isEmpty();
      assertThat(OpenApiValidators.forRequest(s).validate(json("\"id\""))).isEmpty();
    }
  }

  @Test
  @DisplayName("sibling property failures are all reported")
  void propertiesAreExhaustive() {
    JsonNode schema = json("""
        {"properties": {"a": {"type": "string"}, "b": {"type": "integer"}, "c": {"enum": [1]}}}""");

    assertThat(OpenApiValidators.forResponse(schema).validate(json("{\"a\": 1, \"b\": \"x\", \"c\": 2}")))
        .extracting(ValidationError::pointer).containsExactlyInAnyOrder("/a", "/b", "/c");
  }

  @Test
  void configurationsRegisterTheirDirectionKeywords() {
    assertThat(OpenApiValidators.REQUEST_KEYWORDS.registers("readOnly")).isTrue();
    assertThat(OpenApiValidators.REQUEST_KEYWORDS.registers("writeOnly")).isFalse();
    assertThat(OpenApiValidators.RESPONSE_KEYWORDS.registers("writeOnly")).isTrue();
    assertThat(OpenApiValidators.RESPONSE_KEYWORDS.registers("x-writeOnly")).isTrue();
    assertThat(OpenApiValidators.RESPONSE_KEYWORDS.registers("readOnly")).isFalse();
    assertThat(OpenApiValidators.REQUEST_KEYWORDS.keywords())
        .containsExactlyInAnyOrder("type", "enum", "required", "readOnly", "oneOf", "allOf");
    assertThat(OpenApiValidators.RESPONSE_KEYWORDS.keywords())
        .containsExactlyInAnyOrder("type", "enum", "required", "writeOnly", "x-writeOnly", "properties", "oneOf");
    assertThat(OpenApiValidators.forMode(ValidationMode.RESPONSE, json("{}")).keywords())
        .isSameAs(OpenApiValidators.RESPONSE_KEYWORDS);
  }

  static JsonNode json(String s) {
    try {
      return OM.readTree(s);
    } catch (IOException e) {
      throw new IllegalArgumentException(e);
    }
  }
}
