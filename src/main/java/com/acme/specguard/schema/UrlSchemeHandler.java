package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Locale;

/** Reads a JSON (or YAML) document through Spring's {@link ResourceLoader}. */
public class UrlSchemeHandler implements SchemeHandler {
  private static final YAMLMapper YAML = new YAMLMapper();

  private final String scheme;
  private final ResourceLoader rl;
  private final ObjectMapper om;

  public UrlSchemeHandler(String scheme, ResourceLoader rl, ObjectMapper om) {
    this.scheme = scheme; this.rl = rl; this.om = om;
  }

  @Override
  public JsonNode fetch(URI documentUri) {
    String location = documentUri.toString();
    if (!scheme.equalsIgnoreCase(documentUri.getScheme())) {
      throw new RefResolutionException(location, RefResolutionException.Reason.UNSUPPORTED_SCHEME,
          "Handler for '" + scheme + "' cannot fetch " + location);
    }
    Resource r = rl.getResource(location);
    try (InputStream in = r.getInputStream()) {
      JsonNode doc = mapperFor(location).readTree(in);
      if (doc == null || doc.isMissingNode()) {
        throw new RefResolutionException(location, RefResolutionException.Reason.FETCH_FAILED,
            "Empty schema document: " + location);
      }
      return doc;
    } catch (IOException e) {
      throw new RefResolutionException(location, RefResolutionException.Reason.FETCH_FAILED,
          "Cannot fetch schema document: " + location, e);
    }
  }

  private ObjectMapper mapperFor(String location) {
    String lower = location.toLowerCase(Locale.ROOT);
    return lower.endsWith(".yaml") || lower.endsWith(".yml") ? YAML : om;
  }
}
