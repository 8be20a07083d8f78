package io.b2mash.jasper.mcpserver.execution;

public record AsyncExecutionResponse(String executionId, String status) {

  static AsyncExecutionResponse pending(String executionId) {
    return new AsyncExecutionResponse(executionId, "pending");
  }
}
