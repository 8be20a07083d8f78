package io.b2mash.jasper.mcpserver.execution;

public enum ExecutionMode {
  SYNC,
  ASYNC
}
