package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.AbstractJsonValidator;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.Keyword;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.ValidationContext;
import com.networknt.schema.ValidationMessage;

import java.util.List;
import java.util.Map;

/** Base of the OpenAPI keyword validators: knows its enclosing schema and builds its own error messages. */
abstract class KeywordValidator extends AbstractJsonValidator {
  /** {@link ValidationMessage#getDetails()} key holding the branch errors of a failed combinator. */
  static final String CONTEXT = "context";

  protected final String keyword;
  protected final JsonNode value;
  protected final SchemaLocation location;
  protected final JsonNodePath path;
  protected final JsonSchema parentSchema;
  protected final ValidationContext validationContext;

  KeywordValidator(SchemaLocation schemaLocation, JsonNodePath evaluationPath, Keyword keyword, JsonNode schemaNode,
                   JsonSchema parentSchema, ValidationContext validationContext) {
    super(schemaLocation, evaluationPath, keyword, schemaNode);
    this.keyword = keyword.getValue();
    this.value = schemaNode;
    this.location = schemaLocation;
    this.path = evaluationPath;
    this.parentSchema = parentSchema;
    this.validationContext = validationContext;
  }

  /** The schema object this keyword sits in. */
  JsonNode enclosingSchema() { return parentSchema.getSchemaNode(); }

  boolean allowsNull(JsonNode instance) { return Nullability.allowsNull(instance, enclosingSchema()); }

  ValidationMessage error(JsonNode instance, JsonNodePath instanceLocation, String message) {
    return error(instance, instanceLocation, message, List.of());
  }

  ValidationMessage error(JsonNode instance, JsonNodePath instanceLocation, String message,
                          List<ValidationMessage> context) {
    return ValidationMessage.builder()
        .type(keyword)
        .code(keyword)
        .schemaLocation(location)
        .evaluationPath(path)
        .instanceLocation(instanceLocation)
        .instanceNode(instance)
        .schemaNode(value)
        .details(context.isEmpty() ? null : Map.<String, Object>of(CONTEXT, List.copyOf(context)))
        .messageSupplier(() -> message)
        .build();
  }
}
