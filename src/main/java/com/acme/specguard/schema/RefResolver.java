package com.acme.specguard.schema;

import com.acme.specguard.schema.RefResolutionException.Reason;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Inlines JSON references ({@code {"$ref": <uri>}}) in a schema document.
 *
 * <p>The input is deep-copied first and never modified. Same-document references are looked up in
 * the original, unrewritten document; anything else is fetched through the {@link SchemeHandlers}
 * (or taken from the {@link ReferenceStore}) and resolved relative to the document it came from.
 * A reference that expands into itself fails with {@link Reason#CYCLE}.
 */
@Component
public class RefResolver {
  private static final Logger log = LoggerFactory.getLogger(RefResolver.class);
  private static final String REF = "$ref";

  private final SchemeHandlers defaultHandlers;

  public RefResolver(SchemeHandlers defaultHandlers) { this.defaultHandlers = defaultHandlers; }

  public JsonNode resolve(JsonNode spec) {
    return resolve(spec, null, ReferenceStore.empty(), defaultHandlers);
  }

  public JsonNode resolve(JsonNode spec, ReferenceStore store) {
    return resolve(spec, null, store, defaultHandlers);
  }

  public JsonNode resolve(JsonNode spec, ReferenceStore store, SchemeHandlers handlers) {
    return resolve(spec, null, store, handlers);
  }

  /**
   * Resolves every reference reachable from {@code spec}.
   *
   * @param baseUri where {@code spec} was loaded from, used for relative external references; may be null
   * @param store documents fetched so far; gains an entry per successful fetch
   * @param handlers fetchers per URI scheme; the configured defaults when null
   */
  public JsonNode resolve(JsonNode spec, URI baseUri, ReferenceStore store, SchemeHandlers handlers) {
    Objects.requireNonNull(spec, "spec");
    Resolution resolution = new Resolution(
        store == null ? ReferenceStore.empty() : store,
        handlers == null ? defaultHandlers : handlers);
    try {
      JsonNode resolved = resolution.resolveIn(new Scope(spec, baseUri), spec.deepCopy());
      log.info("Resolved schema {} ({} references inlined, {} documents in store)",
          baseUri == null ? "<inline>" : baseUri, resolution.inlined, resolution.store.size());
      return resolved;
    } catch (RefResolutionException e) {
      log.warn("Reference resolution failed for {}: {}", e.uri(), e.getMessage());
      throw e;
    }
  }

  /** The document local references are looked up in, and the URI relative references are resolved against. */
  private record Scope(JsonNode root, URI base) {
    String key(String ref) { return (base == null ? "" : base.toString()) + "::" + ref; }

    URI resolve(String ref) {
      try {
        return base == null ? URI.create(ref) : base.resolve(ref);
      } catch (IllegalArgumentException e) {
        throw new RefResolutionException(ref, Reason.MALFORMED_REF, "Malformed $ref: " + ref, e);
      }
    }
  }

  /** State of one resolve call. */
  private static final class Resolution {
    private final ReferenceStore store;
    private final SchemeHandlers handlers;
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Set<String> active = new LinkedHashSet<>();
    private int inlined;

    Resolution(ReferenceStore store, SchemeHandlers handlers) {
      this.store = store; this.handlers = handlers;
    }

    JsonNode resolveIn(Scope scope, JsonNode node) {
      scopes.push(scope);
      try {
        return walk(node);
      } finally {
        scopes.pop();
      }
    }

    private JsonNode walk(JsonNode node) {
      if (node.isObject()) {
        ObjectNode obj = (ObjectNode) node;
        JsonNode ref = obj.get(REF);
        if (ref != null && ref.isTextual()) return dereference(obj, ref.textValue());
        List<String> names = new ArrayList<>(obj.size());
        obj.fieldNames().forEachRemaining(names::add);
        for (String name : names) obj.set(name, walk(obj.get(name)));
        return obj;
      }
      if (node.isArray()) {
        ArrayNode arr = (ArrayNode) node;
        for (int i = 0; i < arr.size(); i++) arr.set(i, walk(arr.get(i)));
        return arr;
      }
      return node;
    }

    /**
     * Resolves the target while its key is on the active chain, then walks the siblings of {@code $ref}
     * with the key released, so a sibling reusing the same reference is not taken for a cycle.
     */
    private JsonNode dereference(ObjectNode node, String ref) {
      Scope scope = scopes.peek();
      String key = scope.key(ref);
      if (!active.add(key)) {
        throw new RefResolutionException(ref, Reason.CYCLE,
            "Cyclic $ref detected: " + String.join(" -> ", active) + " -> " + key);
      }
      JsonNode target;
      try {
        target = target(scope, ref);
      } finally {
        active.remove(key);
      }
      return merge(node, target);
    }

    private JsonNode target(Scope scope, String ref) {
      Optional<JsonNode> known = lookupLocal(scope.root(), ref);
      if (known.isPresent()) {
        inlined++;
        return walk(known.get().deepCopy());
      }
      if (ref.startsWith("#")) {
        throw new RefResolutionException(ref, Reason.LOCAL_POINTER_MISSING,
            "Unresolvable local $ref: " + ref + (scope.base() == null ? "" : " in " + scope.base()));
      }
      return external(ref);
    }

    /** Fields of the resolved target overwrite the siblings of {@code $ref}; a non-object target replaces the node. */
    private JsonNode merge(ObjectNode node, JsonNode target) {
      if (!target.isObject()) return target;
      node.remove(REF);
      walk(node);
      node.setAll((ObjectNode) target);
      return node;
    }

    private JsonNode external(String ref) {
      URI target = scopes.peek().resolve(ref);
      URI document = withoutFragment(target);
      JsonNode doc = acquire(document);

      String fragment = target.getFragment();
      JsonNode selected = fragment == null || fragment.isEmpty() ? doc : doc.at(asJsonPointer(target, fragment));
      if (selected.isMissingNode()) {
        throw new RefResolutionException(target.toString(), Reason.POINTER_MISSING,
            "Unresolvable JSON pointer " + fragment + " in " + document);
      }
      inlined++;
      return resolveIn(new Scope(doc, document), selected.deepCopy());
    }

    private JsonNode acquire(URI document) {
      String key = document.toString();
      JsonNode cached = store.get(key);
      if (cached != null) {
        log.debug("Reference store hit for {}", key);
        return cached;
      }
      SchemeHandler handler = handlers.handlerFor(document);
      log.debug("Fetching referenced document {}", key);
      JsonNode doc;
      try {
        doc = handler.fetch(document);
      } catch (RefResolutionException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new RefResolutionException(key, Reason.FETCH_FAILED, "Cannot fetch schema document: " + key, e);
      }
      if (doc == null) {
        throw new RefResolutionException(key, Reason.FETCH_FAILED, "Handler returned no document for " + key);
      }
      store.put(key, doc);
      return doc;
    }
  }

  /**
   * Looks {@code ref} up in {@code root} as a slash-separated path after its two-character {@code #/} prefix.
   * Empty when any segment is absent, which is also what happens for references to other documents.
   */
  static Optional<JsonNode> lookupLocal(JsonNode root, String ref) {
    if ("#".equals(ref)) return Optional.of(root);
    if (ref.length() < 2) return Optional.empty();
    JsonNode current = root;
    for (String raw : ref.substring(2).split("/", -1)) {
      String segment = unescape(raw);
      if (current.isObject()) {
        current = current.get(segment);
      } else if (current.isArray() && isIndex(segment)) {
        current = current.get(Integer.parseInt(segment));
      } else {
        return Optional.empty();
      }
      if (current == null) return Optional.empty();
    }
    return Optional.of(current);
  }

  private static String unescape(String segment) {
    String s = segment.indexOf('%') >= 0 ? percentDecode(segment) : segment;
    return s.replace("~1", "/").replace("~0", "~");
  }

  private static String percentDecode(String segment) {
    try {
      return URLDecoder.decode(segment.replace("+", "%2B"), StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      return segment;
    }
  }

  private static boolean isIndex(String segment) {
    if (segment.isEmpty() || segment.length() > 9) return false;
    for (int i = 0; i < segment.length(); i++) {
      if (!Character.isDigit(segment.charAt(i))) return false;
    }
    return true;
  }

  private static URI withoutFragment(URI uri) {
    String s = uri.toString();
    int hash = s.indexOf('#');
    return hash >= 0 ? URI.create(s.substring(0, hash)) : uri;
  }

  private static JsonPointer asJsonPointer(URI target, String fragment) {
    String pointer = fragment.startsWith("/") ? fragment : "/" + fragment;
    try {
      return JsonPointer.compile(pointer);
    } catch (IllegalArgumentException e) {
      throw new RefResolutionException(target.toString(), Reason.POINTER_MISSING,
          "Malformed JSON pointer " + fragment + " in " + target, e);
    }
  }
}
