package io.b2mash.jasper.mcpserver.tool;

public record CancelExecutionResponse(String executionId, boolean cancelled) {}
