package io.b2mash.jasper.mcpserver.execution;

/**
 * What a successful execution produced. {@code exportId} is only set for asynchronous runs, whose
 * content is downloaded on demand.
 */
public record ExecutionOutput(
    String fileName, String contentType, long fileSize, String exportId) {}
