package com.acme.specguard.schema;

import java.util.Objects;

/** A {@code $ref} that could not be turned into a schema node. Fatal for the resolve call that raised it. */
public class RefResolutionException extends RuntimeException {
  private final String uri;
  private final Reason reason;

  public RefResolutionException(String uri, Reason reason, String message) {
    super(message);
    this.uri = Objects.requireNonNull(uri, "uri");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  public RefResolutionException(String uri, Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.uri = Objects.requireNonNull(uri, "uri");
    this.reason = Objects.requireNonNull(reason, "reason");
  }

  /** The reference or document URI that failed, as written or as resolved against its base. */
  public String uri() { return uri; }

  public Reason reason() { return reason; }

  public enum Reason {
    /** No handler registered for the URI scheme, or the URI has no scheme at all. */
    UNSUPPORTED_SCHEME,
    /** The handler could not read or parse the document. */
    FETCH_FAILED,
    /** The document was fetched but the fragment points at nothing. */
    POINTER_MISSING,
    /** A same-document reference ({@code #/...}) points at nothing. */
    LOCAL_POINTER_MISSING,
    /** The reference is not a valid URI. */
    MALFORMED_REF,
    /** The reference expands into itself. */
    CYCLE
  }
}
