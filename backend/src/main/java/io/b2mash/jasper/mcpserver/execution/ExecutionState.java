package io.b2mash.jasper.mcpserver.execution;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of one execution. {@code VALIDATING} is local and happens before the execution is
 * registered with the tracker; tracked records start at {@code RESOLVING_RESOURCE}.
 */
public enum ExecutionState {
  VALIDATING,
  RESOLVING_RESOURCE,
  TRANSFORMING_PARAMS,
  INVOKING,
  PENDING,
  POLLING,
  READY,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == READY || this == FAILED || this == CANCELLED;
  }

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
