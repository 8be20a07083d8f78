package io.b2mash.jasper.mcpserver.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Taxonomy-tagged error surfaced to tool callers, decoupled from the transport or server error it
 * was derived from. Immutable; {@code details} and {@code statusCode} may be null.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record NormalizedError(
    String code,
    ErrorCategory category,
    ErrorSeverity severity,
    String message,
    Map<String, Object> details,
    Integer statusCode,
    String timestamp) {

  public NormalizedError {
    details = details == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  public static NormalizedError of(McpErrorType type, String message, Map<String, Object> details) {
    return of(type, type.getCategory(), message, details, type.getStatusCode());
  }

  public static NormalizedError of(
      McpErrorType type, String message, Map<String, Object> details, Integer statusCode) {
    return of(type, type.getCategory(), message, details, statusCode);
  }

  public static NormalizedError of(
      McpErrorType type,
      ErrorCategory category,
      String message,
      Map<String, Object> details,
      Integer statusCode) {
    return new NormalizedError(
        type.getCode(),
        category,
        type.getSeverity(),
        message == null || message.isBlank() ? type.getDefaultMessage() : message,
        details,
        statusCode,
        Instant.now().toString());
  }
}
