package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.networknt.schema.AbstractKeyword;
import com.networknt.schema.ExecutionContext;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonValidator;
import com.networknt.schema.Keyword;
import com.networknt.schema.SchemaLocation;
import com.networknt.schema.ValidationContext;
import com.networknt.schema.ValidationMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OpenAPI overrides of the Draft-4 keywords: nullable schemas, read-only and write-only properties,
 * and the {@code oneOf} / {@code allOf} combinators. {@link OpenApiValidators} installs them over
 * the Draft-4 meta-schema.
 */
public final class OpenApiKeywords {
  private OpenApiKeywords() {}

  /** {@code baseline}, skipped for a null instance under a nullable schema. */
  public static Keyword nullable(Keyword baseline) { return new NullableKeyword(baseline); }

  /**
   * {@code required}; a missing property is tolerated when it carries one of {@code exemptingMarkers}
   * ({@code readOnly}, {@code writeOnly}, {@code x-writeOnly}).
   */
  public static Keyword required(Set<String> exemptingMarkers) { return new RequiredKeyword(exemptingMarkers); }

  public static Keyword readOnly() { return new DirectionKeyword("readOnly", "Property is read-only"); }

  public static Keyword writeOnly() { return new DirectionKeyword("writeOnly", "Property is write-only"); }

  public static Keyword xWriteOnly() { return new DirectionKeyword("x-writeOnly", "Property is write-only"); }

  public static Keyword oneOf() { return new OneOfKeyword(); }

  public static Keyword allOf() { return new AllOfKeyword(); }

  private static final class NullableKeyword extends AbstractKeyword {
    private final Keyword baseline;

    NullableKeyword(Keyword baseline) {
      super(baseline.getValue());
      this.baseline = baseline;
    }

    @Override
    public JsonValidator newValidator(SchemaLocation schemaLocation, JsonNodePath evaluationPath, JsonNode schemaNode,
                                      JsonSchema parentSchema, ValidationContext validationContext) throws Exception {
      JsonValidator delegate = baseline.newValidator(schemaLocation, evaluationPath, schemaNode, parentSchema,
          validationContext);
      return new KeywordValidator(schemaLocation, evaluationPath, this, schemaNode, parentSchema, validationContext) {
        @Override
        public Set<ValidationMessage> validate(ExecutionContext executionContext, JsonNode node, JsonNode rootNode,
                                               JsonNodePath instanceLocation) {
          if (allowsNull(node)) return Collections.emptySet();
          return delegate.validate(executionContext, node, rootNode, instanceLocation);
        }

        @Override
        public void preloadJsonSchema() { delegate.preloadJsonSchema(); }
      };
    }
  }

  private static final class RequiredKeyword extends AbstractKeyword {
    private final Set<String> exemptingMarkers;

    RequiredKeyword(Set<String> exemptingMarkers) {
      super("required");
      this.exemptingMarkers = Set.copyOf(exemptingMarkers);
    }

    @Override
    public JsonValidator newValidator(SchemaLocation schemaLocation, JsonNodePath evaluationPath, JsonNode schemaNode,
                                      JsonSchema parentSchema, ValidationContext validationContext) {
      if (!schemaNode.isArray()) {
        throw new SchemaDefinitionException("required must be an array at " + evaluationPath);
      }
      return new KeywordValidator(schemaLocation, evaluationPath, this, schemaNode, parentSchema, validationContext) {
        @Override
        public Set<ValidationMessage> validate(ExecutionContext executionContext, JsonNode node, JsonNode rootNode,
                                               JsonNodePath instanceLocation) {
          if (!node.isObject()) return Collections.emptySet();
          JsonNode properties = enclosingSchema().get("properties");
          Set<ValidationMessage> errors = new LinkedHashSet<>();
          for (JsonNode each : value) {
            String prop = each.asText();
            if (node.has(prop)) continue;
            JsonNode subschema = properties == null ? null : properties.get(prop);
            if (subschema != null && isExempt(subschema)) continue;
            errors.add(error(node, instanceLocation, "'" + prop + "' is a required property"));
          }
          return errors;
        }
      };
    }

    private boolean isExempt(JsonNode subschema) {
      if (exemptingMarkers.contains("readOnly") && Nullability.isTruthy(subschema.get("readOnly"))) return true;
      if (exemptingMarkers.contains("writeOnly") && Nullability.isTruthy(subschema.get("writeOnly"))) return true;
      return exemptingMarkers.contains("x-writeOnly") && Nullability.isTrue(subschema.get("x-writeOnly"));
    }
  }

  /**
   * Reached only by descending into a property the instance has, so firing at all means a value was
   * supplied in the direction that forbids it.
   */
  private static final class DirectionKeyword extends AbstractKeyword {
    private final String message;

    DirectionKeyword(String keyword, String message) {
      super(keyword);
      this.message = message;
    }

    @Override
    public JsonValidator newValidator(SchemaLocation schemaLocation, JsonNodePath evaluationPath, JsonNode schemaNode,
                                      JsonSchema parentSchema, ValidationContext validationContext) {
      return new KeywordValidator(schemaLocation, evaluationPath, this, schemaNode, parentSchema, validationContext) {
        @Override
        public Set<ValidationMessage> validate(ExecutionContext executionContext, JsonNode node, JsonNode rootNode,
                                               JsonNodePath instanceLocation) {
          return Collections.singleton(error(node, instanceLocation, message));
        }
      };
    }
  }

  /** Exactly one branch must match. Every branch is tried, so a second match is reported too. */
  private static final class OneOfKeyword extends AbstractKeyword {
    OneOfKeyword() { super("oneOf"); }

    @Override
    public JsonValidator newValidator(SchemaLocation schemaLocation, JsonNodePath evaluationPath, JsonNode schemaNode,
                                      JsonSchema parentSchema, ValidationContext validationContext) {
      if (!schemaNode.isArray()) {
        throw new SchemaDefinitionException("oneOf must be an array at " + evaluationPath);
      }
      List<JsonSchema> branches = new ArrayList<>(schemaNode.size());
      for (int i = 0; i < schemaNode.size(); i++) {
        branches.add(validationContext.newSchema(schemaLocation.append(i), evaluationPath.append(i),
            schemaNode.get(i), parentSchema));
      }
      return new KeywordValidator(schemaLocation, evaluationPath, this, schemaNode, parentSchema, validationContext) {
        @Override
        public Set<ValidationMessage> validate(ExecutionContext executionContext, JsonNode node, JsonNode rootNode,
                                               JsonNodePath instanceLocation) {
          if (allowsNull(node)) return Collections.emptySet();
          List<Integer> matched = new ArrayList<>();
          List<ValidationMessage> context = new ArrayList<>();
          for (int i = 0; i < branches.size(); i++) {
            Set<ValidationMessage> errors = branches.get(i).validate(executionContext, node, rootNode, instanceLocation);
            if (errors.isEmpty()) {
              matched.add(i);
            } else {
              context.addAll(errors);
            }
          }
          if (matched.size() == 1) return Collections.emptySet();
          if (matched.isEmpty()) {
            return Collections.singleton(
                error(node, instanceLocation, node + " is not valid under any of the given schemas", context));
          }
          String reprs = matched.stream().map(i -> value.get(i).toString()).collect(Collectors.joining(", "));
          return Collections.singleton(error(node, instanceLocation, node + " is valid under each of " + reprs));
        }

        @Override
        public void preloadJsonSchema() { branches.forEach(JsonSchema::initializeValidators); }
      };
    }
  }

  /**
   * Shallow-merges the subschemas in order, later keywords overwriting earlier ones, and validates the
   * merged schema once. Each error is filed under the index of the subschema its keyword came from.
   */
  private static final class AllOfKeyword extends AbstractKeyword {
    AllOfKeyword() { super("allOf"); }

    @Override
    public JsonValidator newValidator(SchemaLocation schemaLocation, JsonNodePath evaluationPath, JsonNode schemaNode,
                                      JsonSchema parentSchema, ValidationContext validationContext) {
      if (!schemaNode.isArray()) {
        throw new SchemaDefinitionException("allOf must be an array at " + evaluationPath);
      }
      ObjectNode merged = JsonNodeFactory.instance.objectNode();
      Map<String, Integer> owner = new HashMap<>();
      for (int i = 0; i < schemaNode.size(); i++) {
        JsonNode sub = schemaNode.get(i);
        if (!sub.isObject()) continue;
        int index = i;
        sub.fields().forEachRemaining(e -> {
          merged.set(e.getKey(), e.getValue());
          owner.put(e.getKey(), index);
        });
      }
      JsonSchema mergedSchema = validationContext.newSchema(schemaLocation, evaluationPath, merged, parentSchema);
      return new KeywordValidator(schemaLocation, evaluationPath, this, schemaNode, parentSchema, validationContext) {
        @Override
        public Set<ValidationMessage> validate(ExecutionContext executionContext, JsonNode node, JsonNode rootNode,
                                               JsonNodePath instanceLocation) {
          Set<ValidationMessage> errors = mergedSchema.validate(executionContext, node, rootNode, instanceLocation);
          if (errors.isEmpty()) return errors;
          Set<ValidationMessage> filed = new LinkedHashSet<>();
          for (ValidationMessage m : errors) filed.add(fileUnderOwner(m));
          return filed;
        }

        private ValidationMessage fileUnderOwner(ValidationMessage m) {
          JsonNodePath from = m.getEvaluationPath();
          int depth = path.getNameCount();
          if (from == null || from.getNameCount() <= depth) return m;
          Integer index = owner.get(String.valueOf(from.getElement(depth)));
          if (index == null) return m;
          JsonNodePath to = path.append(index);
          for (int i = depth; i < from.getNameCount(); i++) {
            Object element = from.getElement(i);
            to = element instanceof Integer n ? to.append(n) : to.append(String.valueOf(element));
          }
          return ValidationMessage.builder()
              .type(m.getType())
              .code(m.getCode())
              .schemaLocation(m.getSchemaLocation())
              .evaluationPath(to)
              .instanceLocation(m.getInstanceLocation())
              .instanceNode(m.getInstanceNode())
              .schemaNode(m.getSchemaNode())
              .details(m.getDetails())
              .messageSupplier(m::getMessage)
              .build();
        }

        @Override
        public void preloadJsonSchema() { mergedSchema.initializeValidators(); }
      };
    }
  }
}
