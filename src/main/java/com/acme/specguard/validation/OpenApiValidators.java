package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.Keyword;
import com.networknt.schema.ValidatorTypeCode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The two OpenAPI validator configurations. Request validators reject read-only properties and
 * forgive their absence; response validators do the same for write-only properties and let nullable
 * objects skip their {@code properties}.
 */
public final class OpenApiValidators {
  private OpenApiValidators() {}

  private static final Set<String> DIRECTION_MARKERS = Set.of("readOnly", "writeOnly", "x-writeOnly");

  public static final KeywordRegistry REQUEST_KEYWORDS = configuration(List.of(
      OpenApiKeywords.nullable(ValidatorTypeCode.TYPE),
      OpenApiKeywords.nullable(ValidatorTypeCode.ENUM),
      OpenApiKeywords.readOnly(),
      OpenApiKeywords.oneOf(),
      OpenApiKeywords.allOf()));

  public static final KeywordRegistry RESPONSE_KEYWORDS = configuration(List.of(
      OpenApiKeywords.nullable(ValidatorTypeCode.TYPE),
      OpenApiKeywords.nullable(ValidatorTypeCode.ENUM),
      OpenApiKeywords.writeOnly(),
      OpenApiKeywords.xWriteOnly(),
      OpenApiKeywords.nullable(ValidatorTypeCode.PROPERTIES),
      OpenApiKeywords.oneOf()));

  /** Draft-4 plus {@code keywords}, with {@code required} exempting the direction markers among them. */
  private static KeywordRegistry configuration(List<Keyword> keywords) {
    Set<String> markers = keywords.stream().map(Keyword::getValue).filter(DIRECTION_MARKERS::contains)
        .collect(Collectors.toSet());
    List<Keyword> all = new ArrayList<>(keywords);
    all.add(OpenApiKeywords.required(markers));
    return KeywordRegistry.draft4().extend(all);
  }

  public static SchemaValidator forRequest(JsonNode schema) { return new SchemaValidator(REQUEST_KEYWORDS, schema); }

  public static SchemaValidator forResponse(JsonNode schema) { return new SchemaValidator(RESPONSE_KEYWORDS, schema); }

  public static SchemaValidator forMode(ValidationMode mode, JsonNode schema) {
    return switch (mode) {
      case REQUEST -> forRequest(schema);
      case RESPONSE -> forResponse(schema);
    };
  }
}
