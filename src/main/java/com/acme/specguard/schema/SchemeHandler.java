package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;

/**
 * Fetches and parses the document behind a URI of one scheme.
 * Implementations report failures as {@link RefResolutionException}.
 */
@FunctionalInterface
public interface SchemeHandler {
  JsonNode fetch(URI documentUri);
}
