package com.acme.specguard.validation;

/** The schema itself cannot be used: a keyword value the engine fails to compile or evaluate. */
public class SchemaDefinitionException extends RuntimeException {
  public SchemaDefinitionException(String message) { super(message); }

  public SchemaDefinitionException(String message, Throwable cause) { super(message, cause); }
}
