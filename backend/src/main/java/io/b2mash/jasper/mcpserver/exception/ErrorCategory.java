package io.b2mash.jasper.mcpserver.exception;

import com.fasterxml.jackson.annotation.JsonValue;

/** Discriminant of a {@link NormalizedError}. */
public enum ErrorCategory {
  AUTHENTICATION,
  AUTHORIZATION,
  VALIDATION,
  RESOURCE,
  EXECUTION,
  NETWORK,
  CONFIGURATION,
  INTERNAL;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
