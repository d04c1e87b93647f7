package com.acme.specguard.validation;

import java.util.Locale;

/** Direction of the payload being validated. */
public enum ValidationMode {
  /** Inbound payload: read-only properties may be omitted and must not be sent. */
  REQUEST,
  /** Outbound payload: write-only properties may be omitted and must not be echoed. */
  RESPONSE;

  public static ValidationMode parse(String value) {
    if (value == null) throw new IllegalArgumentException("Validation mode is required");
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown validation mode: " + value, e);
    }
  }
}
