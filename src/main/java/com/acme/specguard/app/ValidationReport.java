package com.acme.specguard.app;

import com.acme.specguard.validation.ValidationError;
import com.acme.specguard.validation.ValidationMode;

import java.util.List;

public record ValidationReport(String schema, ValidationMode mode, List<ValidationError> errors) {
  public boolean valid() { return errors.isEmpty(); }
}
