package com.acme.specguard.schema;

public class SchemaNotFoundException extends RuntimeException {
  private final String name;

  public SchemaNotFoundException(String name, String message) {
    super(message);
    this.name = name;
  }

  public String name() { return name; }
}
