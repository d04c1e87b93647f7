package com.acme.specguard.app;

import com.acme.specguard.schema.RefResolver;
import com.acme.specguard.schema.ReferenceStore;
import com.acme.specguard.schema.SchemaLoader;
import com.acme.specguard.schema.SchemeHandlers;
import com.acme.specguard.validation.OpenApiValidators;
import com.acme.specguard.validation.SchemaValidator;
import com.acme.specguard.validation.ValidationError;
import com.acme.specguard.validation.ValidationMode;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Validates payloads against named schemas. Each schema is loaded and resolved once, then served
 * from cache with its request and response validators.
 */
@Service
public class SchemaValidationService {
  private static final Logger log = LoggerFactory.getLogger(SchemaValidationService.class);

  private final SchemaLoader loader;
  private final RefResolver resolver;
  private final SchemeHandlers handlers;
  private final List<String> preload;
  private final Map<String, CompiledSchema> cache = new ConcurrentHashMap<>();
  // resolve calls share this store, so they run under resolveLock
  private final ReferenceStore store = ReferenceStore.empty();
  private final Object resolveLock = new Object();

  public SchemaValidationService(SchemaLoader loader, RefResolver resolver, SchemeHandlers handlers,
                                 @Value("${specguard.resolver.preload:}") String preload) {
    this.loader = loader; this.resolver = resolver; this.handlers = handlers;
    this.preload = Arrays.stream(preload.split(",")).map(String::trim).filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
    this.preload.forEach(this::compiled);
  }

  public ValidationReport validate(String schemaName, ValidationMode mode, JsonNode payload) {
    SchemaValidator validator = compiled(schemaName).validator(mode);
    List<ValidationError> errors = validator.validate(payload);
    if (!errors.isEmpty()) {
      log.debug("{} payload for {} has {} validation errors", mode, schemaName, errors.size());
    }
    return new ValidationReport(schemaName, mode, errors);
  }

  /** The resolved schema that validation runs against. */
  public JsonNode resolvedSchema(String schemaName) { return compiled(schemaName).schema(); }

  public void evict(String schemaName) {
    if (cache.remove(schemaName) != null) log.info("Evicted schema {}", schemaName);
  }

  /** Forgets every compiled schema; the next validation of each name resolves it again. */
  public void reload() {
    synchronized (resolveLock) {
      cache.clear();
      log.info("Schema cache cleared, {} referenced documents kept", store.size());
    }
  }

  public List<String> preloaded() { return preload; }

  private CompiledSchema compiled(String schemaName) {
    CompiledSchema hit = cache.get(schemaName);
    if (hit != null) return hit;
    synchronized (resolveLock) {
      return cache.computeIfAbsent(schemaName, this::compile);
    }
  }

  private CompiledSchema compile(String schemaName) {
    var loaded = loader.load(schemaName);
    JsonNode resolved = resolver.resolve(loaded.root(), loaded.baseUri(), store, handlers);
    log.info("Compiled schema {} from {}", schemaName, loaded.baseUri());
    return new CompiledSchema(resolved, OpenApiValidators.forRequest(resolved), OpenApiValidators.forResponse(resolved));
  }

  private record CompiledSchema(JsonNode schema, SchemaValidator request, SchemaValidator response) {
    SchemaValidator validator(ValidationMode mode) {
      return mode == ValidationMode.REQUEST ? request : response;
    }
  }
}
