package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.util.regex.Pattern;

/** Loads {@code <name>.schema.json} (or {@code .schema.yaml}) from the configured schema location. */
@Component
public class SchemaLoader {
  private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);
  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");
  private static final YAMLMapper YAML = new YAMLMapper();

  private final ResourceLoader rl;
  private final ObjectMapper om;
  private final String basePath;

  public SchemaLoader(ResourceLoader rl, ObjectMapper om,
                      @Value("${specguard.schemas.base-path:classpath:/schemas/}") String basePath) {
    this.rl = rl; this.om = om;
    this.basePath = basePath.endsWith("/") ? basePath : basePath + "/";
  }

  public LoadedSchema load(String name) {
    if (name == null || !NAME.matcher(name).matches() || name.contains("..")) {
      throw new SchemaNotFoundException(name, "Invalid schema name: " + name);
    }
    String location = basePath + name + ".schema.json";
    Resource r = rl.getResource(location);
    ObjectMapper mapper = om;
    if (!r.exists()) {
      location = basePath + name + ".schema.yaml";
      r = rl.getResource(location);
      mapper = YAML;
    }
    if (!r.exists()) throw new SchemaNotFoundException(name, "Schema not found: " + name + " under " + basePath);

    try (InputStream in = r.getInputStream()) {
      JsonNode root = mapper.readTree(in);
      // classpath: locations stay hierarchical inside a jar, so relative refs resolve against them
      URI baseUri = location.startsWith("classpath:") ? URI.create(location) : r.getURI();
      log.debug("Loaded schema {} from {}", name, baseUri);
      return new LoadedSchema(name, root, baseUri);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot read schema: " + name, e);
    }
  }

  public String basePath() { return basePath; }

  public record LoadedSchema(String name, JsonNode root, URI baseUri) {}
}
