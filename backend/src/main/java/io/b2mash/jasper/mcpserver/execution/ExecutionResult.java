package io.b2mash.jasper.mcpserver.execution;

/**
 * Rendered report returned to the caller. {@code content} is base64 encoded in JSON; {@code
 * exportId} is set for output downloaded from an asynchronous execution.
 */
public record ExecutionResult(
    boolean success,
    String executionId,
    String status,
    String outputFormat,
    String reportUri,
    byte[] content,
    String contentType,
    String fileName,
    long fileSize,
    long generationTimeMs,
    String pages,
    String exportId) {

  static final String STATUS_READY = "ready";
}
