package io.b2mash.jasper.mcpserver.exception;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorSeverity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
