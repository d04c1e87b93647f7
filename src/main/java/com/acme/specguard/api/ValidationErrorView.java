package com.acme.specguard.api;

import com.acme.specguard.validation.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

public record ValidationErrorView(String message, String path, String schemaPath, String keyword,
                                  List<ValidationErrorView> context) {
  public static ValidationErrorView of(ValidationError e) {
    return new ValidationErrorView(e.message(), e.pointer(), e.schemaPointer(), e.keyword(),
        e.context().stream().map(ValidationErrorView::of).collect(Collectors.toList()));
  }
}
