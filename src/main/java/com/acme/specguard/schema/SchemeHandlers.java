package com.acme.specguard.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.ResourceLoader;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Immutable URI scheme to {@link SchemeHandler} registry used for external references. */
public final class SchemeHandlers {
  private final Map<String, SchemeHandler> handlers;

  private SchemeHandlers(Map<String, SchemeHandler> handlers) {
    this.handlers = Collections.unmodifiableMap(handlers);
  }

  public static SchemeHandlers of(Map<String, ? extends SchemeHandler> handlers) {
    Map<String, SchemeHandler> copy = new LinkedHashMap<>();
    handlers.forEach((scheme, h) -> copy.put(scheme.toLowerCase(Locale.ROOT), h));
    return new SchemeHandlers(copy);
  }

  /** http, https and file through the resource loader, plus classpath for schemas shipped in the jar. */
  public static SchemeHandlers defaults(ResourceLoader rl, ObjectMapper om) {
    Map<String, SchemeHandler> map = new LinkedHashMap<>();
    for (String scheme : new String[] {"http", "https", "file", "classpath"}) {
      map.put(scheme, new UrlSchemeHandler(scheme, rl, om));
    }
    return new SchemeHandlers(map);
  }

  /** Copy of this registry with {@code scheme} bound to {@code handler}. */
  public SchemeHandlers with(String scheme, SchemeHandler handler) {
    Map<String, SchemeHandler> copy = new LinkedHashMap<>(handlers);
    copy.put(scheme.toLowerCase(Locale.ROOT), handler);
    return new SchemeHandlers(copy);
  }

  public Set<String> schemes() { return handlers.keySet(); }

  public SchemeHandler handlerFor(URI uri) {
    String scheme = uri.getScheme();
    if (scheme == null) {
      throw new RefResolutionException(uri.toString(), RefResolutionException.Reason.UNSUPPORTED_SCHEME,
          "Cannot resolve relative reference without a base URI: " + uri);
    }
    SchemeHandler handler = handlers.get(scheme.toLowerCase(Locale.ROOT));
    if (handler == null) {
      throw new RefResolutionException(uri.toString(), RefResolutionException.Reason.UNSUPPORTED_SCHEME,
          "No handler registered for scheme '" + scheme + "': " + uri);
    }
    return handler;
  }
}
