package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.ValidationMessage;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A keyword registry bound to a root schema, compiled once. Holds no per-call state, so one instance
 * can serve concurrent validations.
 */
public class SchemaValidator {
  private final KeywordRegistry keywords;
  private final JsonNode schema;
  private final JsonSchema compiled;

  /** @throws SchemaDefinitionException when {@code schema} has a keyword value the engine cannot compile */
  public SchemaValidator(KeywordRegistry keywords, JsonNode schema) {
    this.keywords = Objects.requireNonNull(keywords, "keywords");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.compiled = keywords.compile(schema);
  }

  public JsonNode schema() { return schema; }

  public KeywordRegistry keywords() { return keywords; }

  /** Whether this configuration installs its own handler for {@code keyword}. */
  public boolean registers(String keyword) { return keywords.registers(keyword); }

  /** Lazy errors of {@code instance} against the root schema. Nothing runs until the stream is consumed; each call starts over. */
  public Stream<ValidationError> iterErrors(JsonNode instance) { return errors(compiled, instance); }

  /** As {@link #iterErrors(JsonNode)}, against another schema under the same keywords. */
  public Stream<ValidationError> iterErrors(JsonNode instance, JsonNode schema) {
    return errors(keywords.compile(schema), instance);
  }

  public boolean isValid(JsonNode instance) { return iterErrors(instance).findAny().isEmpty(); }

  /** All errors of {@code instance}; empty when valid. */
  public List<ValidationError> validate(JsonNode instance) {
    return iterErrors(instance).collect(Collectors.toList());
  }

  private static Stream<ValidationError> errors(JsonSchema target, JsonNode instance) {
    JsonNode node = instance == null ? NullNode.getInstance() : instance;
    return Stream.of(target).flatMap(s -> run(s, node).stream()).map(ValidationError::from);
  }

  private static Set<ValidationMessage> run(JsonSchema target, JsonNode node) {
    try {
      return target.validate(node);
    } catch (JsonSchemaException | IllegalArgumentException e) {
      throw new SchemaDefinitionException("Schema cannot be evaluated: " + e.getMessage(), e);
    }
  }
}
