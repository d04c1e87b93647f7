package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Documents already fetched during resolution, keyed by absolute document URI (fragment stripped).
 * Owned by the caller and reusable across resolve calls. Not thread-safe: concurrent resolve calls
 * sharing one store must be serialized by the caller.
 */
public final class ReferenceStore {
  private final Map<String, JsonNode> documents;

  private ReferenceStore(Map<String, JsonNode> documents) { this.documents = documents; }

  public static ReferenceStore empty() { return new ReferenceStore(new LinkedHashMap<>()); }

  /** Pre-seeded store; avoids network calls for the given documents. */
  public static ReferenceStore of(Map<String, ? extends JsonNode> seed) {
    ReferenceStore store = empty();
    seed.forEach(store::put);
    return store;
  }

  public JsonNode get(String uri) { return documents.get(documentKey(uri)); }

  public boolean contains(String uri) { return documents.containsKey(documentKey(uri)); }

  public void put(String uri, JsonNode document) {
    documents.put(documentKey(uri), Objects.requireNonNull(document, "document"));
  }

  public int size() { return documents.size(); }

  public Set<String> uris() { return Collections.unmodifiableSet(documents.keySet()); }

  static String documentKey(String uri) {
    Objects.requireNonNull(uri, "uri");
    int hash = uri.indexOf('#');
    return hash >= 0 ? uri.substring(0, hash) : uri;
  }
}
