package com.acme.specguard.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonMetaSchema;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaException;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.Keyword;
import com.networknt.schema.NonValidationKeyword;
import com.networknt.schema.SpecVersion;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A Draft-4 keyword set with overrides installed by name. Backed by its own networknt meta-schema
 * and factory, so registries never see each other's keywords.
 */
public final class KeywordRegistry {
  static final String META_SCHEMA_IRI = "https://specguard.acme.com/meta/draft-04-openapi";

  // accepted on any schema; the configurations that act on them install a handler over these
  private static final List<String> MARKERS =
      List.of("$ref", "nullable", "x-nullable", "readOnly", "writeOnly", "x-writeOnly");

  private static final KeywordRegistry DRAFT4 = new KeywordRegistry(new LinkedHashMap<>());

  private final Map<String, Keyword> handlers;
  private final JsonSchemaFactory factory;

  private KeywordRegistry(Map<String, Keyword> handlers) {
    this.handlers = Collections.unmodifiableMap(handlers);
    JsonMetaSchema.Builder metaSchema = JsonMetaSchema.builder(META_SCHEMA_IRI, JsonMetaSchema.getV4());
    MARKERS.forEach(name -> metaSchema.keyword(new NonValidationKeyword(name)));
    handlers.values().forEach(metaSchema::keyword);
    this.factory = JsonSchemaFactory.builder(JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V4))
        .metaSchema(metaSchema.build())
        .defaultMetaSchemaIri(META_SCHEMA_IRI)
        .build();
  }

  /** Plain Draft-4 validation. A leftover {@code $ref} is ignored rather than fetched. */
  public static KeywordRegistry draft4() { return DRAFT4; }

  /** New registry with {@code overrides} replacing or adding keywords; this one is unchanged. */
  public KeywordRegistry extend(Collection<? extends Keyword> overrides) {
    Map<String, Keyword> copy = new LinkedHashMap<>(handlers);
    overrides.forEach(k -> copy.put(k.getValue(), k));
    return new KeywordRegistry(copy);
  }

  /** Whether this registry installs its own handler for {@code keyword}. */
  public boolean registers(String keyword) { return handlers.containsKey(keyword); }

  /** Names of the installed overrides. */
  public Set<String> keywords() { return handlers.keySet(); }

  /** Compiles {@code schema} with every validator built up front, so schema defects surface here. */
  public JsonSchema compile(JsonNode schema) {
    try {
      JsonSchema compiled = factory.getSchema(schema);
      compiled.initializeValidators();
      return compiled;
    } catch (JsonSchemaException | IllegalArgumentException e) {
      throw new SchemaDefinitionException("Invalid schema: " + e.getMessage(), e);
    }
  }
}
