package com.acme.specguard.api;

import com.acme.specguard.app.ValidationReport;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public record ValidationResponse(String schema, String mode, boolean valid, List<ValidationErrorView> errors) {
  public static ValidationResponse of(ValidationReport report) {
    return new ValidationResponse(report.schema(), report.mode().name().toLowerCase(Locale.ROOT), report.valid(),
        report.errors().stream().map(ValidationErrorView::of).collect(Collectors.toList()));
  }
}
