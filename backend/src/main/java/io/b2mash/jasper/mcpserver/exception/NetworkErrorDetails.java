package io.b2mash.jasper.mcpserver.exception;

/**
 * Diagnostics for a failed exchange with the report server.
 *
 * @param cause short machine-readable cause, e.g. {@code timeout} or {@code connection_refused}
 */
public record NetworkErrorDetails(String url, String method, Integer statusCode, String cause) {}
