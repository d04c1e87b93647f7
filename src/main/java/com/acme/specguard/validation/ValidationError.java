package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonNodePath;
import com.networknt.schema.ValidationMessage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One validation failure, read off the engine's {@link ValidationMessage}.
 *
 * <p>{@code path} holds property names ({@link String}) and array indexes ({@link Integer}) from the
 * instance root; {@code schemaPath} holds the keywords, property names and subschema indexes from the
 * schema root. {@code context} carries the branch errors of a failed {@code oneOf}.
 */
public final class ValidationError {
  private final String message;
  private final String keyword;
  private final JsonNode keywordValue;
  private final JsonNode instance;
  private final List<Object> path;
  private final List<Object> schemaPath;
  private final List<ValidationError> context;

  private ValidationError(String message, String keyword, JsonNode keywordValue, JsonNode instance,
                          List<Object> path, List<Object> schemaPath, List<ValidationError> context) {
    this.message = Objects.requireNonNull(message, "message");
    this.keyword = keyword;
    this.keywordValue = keywordValue;
    this.instance = instance;
    this.path = Collections.unmodifiableList(path);
    this.schemaPath = Collections.unmodifiableList(schemaPath);
    this.context = Collections.unmodifiableList(context);
  }

  public static ValidationError from(ValidationMessage m) {
    List<ValidationError> context = new ArrayList<>();
    Map<String, Object> details = m.getDetails();
    if (details != null && details.get(KeywordValidator.CONTEXT) instanceof List<?> nested) {
      for (Object each : nested) {
        if (each instanceof ValidationMessage vm) context.add(from(vm));
      }
    }
    return new ValidationError(m.getMessage(), m.getType(), m.getSchemaNode(), m.getInstanceNode(),
        elements(m.getInstanceLocation()), elements(m.getEvaluationPath()), context);
  }

  private static List<Object> elements(JsonNodePath p) {
    if (p == null) return List.of();
    List<Object> out = new ArrayList<>(p.getNameCount());
    for (int i = 0; i < p.getNameCount(); i++) out.add(p.getElement(i));
    return out;
  }

  public String message() { return message; }

  /** The schema keyword that failed, e.g. {@code type} or {@code required}. */
  public String keyword() { return keyword; }

  public JsonNode keywordValue() { return keywordValue; }

  /** The part of the instance the failing keyword looked at. */
  public JsonNode instance() { return instance; }

  public List<Object> path() { return path; }

  public List<Object> schemaPath() { return schemaPath; }

  public List<ValidationError> context() { return context; }

  /** {@link #path()} as a JSON pointer; empty string for the instance root. */
  public String pointer() { return toPointer(path); }

  public String schemaPointer() { return toPointer(schemaPath); }

  static String toPointer(List<Object> elements) {
    StringBuilder sb = new StringBuilder();
    for (Object e : elements) {
      sb.append('/').append(String.valueOf(e).replace("~", "~0").replace("/", "~1"));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return message + " (at '" + pointer() + "', schema '" + schemaPointer() + "')";
  }
}
