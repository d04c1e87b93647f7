package com.acme.specguard.api;

import com.acme.specguard.app.SchemaValidationService;
import com.acme.specguard.app.ValidationReport;
import com.acme.specguard.schema.RefResolutionException;
import com.acme.specguard.schema.SchemaNotFoundException;
import com.acme.specguard.validation.SchemaDefinitionException;
import com.acme.specguard.validation.ValidationMode;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/validate")
@Validated
public class ValidationController {
  private static final Logger log = LoggerFactory.getLogger(ValidationController.class);

  private final SchemaValidationService service;

  public ValidationController(SchemaValidationService service) { this.service = service; }

  @PostMapping("/{schema}")
  public ResponseEntity<ValidationResponse> validate(@PathVariable("schema") @NotBlank String schema,
                                                     @RequestParam(name = "mode", defaultValue = "request") String mode,
                                                     @RequestBody JsonNode payload) {
    ValidationReport report = service.validate(schema, ValidationMode.parse(mode), payload);
    return ResponseEntity.status(report.valid() ? HttpStatus.OK : HttpStatus.BAD_REQUEST)
        .body(ValidationResponse.of(report));
  }

  @GetMapping("/{schema}")
  public JsonNode resolved(@PathVariable("schema") @NotBlank String schema) {
    return service.resolvedSchema(schema);
  }

  @ExceptionHandler(SchemaNotFoundException.class)
  public ResponseEntity<Map<String, Object>> notFound(SchemaNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Map<String, Object>> badArgument(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
  }

  @ExceptionHandler(SchemaDefinitionException.class)
  public ResponseEntity<Map<String, Object>> unusableSchema(SchemaDefinitionException e) {
    log.error("Schema cannot be used: {}", e.getMessage(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
  }

  @ExceptionHandler(RefResolutionException.class)
  public ResponseEntity<Map<String, Object>> unresolvable(RefResolutionException e) {
    log.error("Schema cannot be used, reference {} failed ({})", e.uri(), e.reason(), e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", e.getMessage(), "uri", e.uri(), "reason", e.reason().name()));
  }
}
