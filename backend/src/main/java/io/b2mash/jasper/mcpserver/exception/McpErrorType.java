package io.b2mash.jasper.mcpserver.exception;

/**
 * Taxonomy entries surfaced to tool callers. Each entry carries the defaults used when an error is
 * created without an explicit category, severity or status code.
 */
public enum McpErrorType {
  INVALID_REQUEST(
      "InvalidRequest", ErrorCategory.VALIDATION, ErrorSeverity.LOW, 400, "Invalid request"),
  INVALID_PARAMS(
      "InvalidParams", ErrorCategory.VALIDATION, ErrorSeverity.LOW, 400, "Invalid parameters"),
  AUTHENTICATION_REQUIRED(
      "AuthenticationRequired",
      ErrorCategory.AUTHENTICATION,
      ErrorSeverity.HIGH,
      401,
      "Authentication required"),
  PERMISSION_DENIED(
      "PermissionDenied",
      ErrorCategory.AUTHORIZATION,
      ErrorSeverity.MEDIUM,
      403,
      "Permission denied"),
  RESOURCE_NOT_FOUND(
      "ResourceNotFound", ErrorCategory.RESOURCE, ErrorSeverity.LOW, 404, "Resource not found"),
  RESOURCE_CONFLICT(
      "ResourceConflict", ErrorCategory.RESOURCE, ErrorSeverity.MEDIUM, 409, "Resource conflict"),
  TIMEOUT("TimeoutError", ErrorCategory.NETWORK, ErrorSeverity.MEDIUM, 408, "Request timeout"),
  CONNECTION(
      "ConnectionError", ErrorCategory.NETWORK, ErrorSeverity.HIGH, null, "Connection error"),
  INTERNAL(
      "InternalError", ErrorCategory.INTERNAL, ErrorSeverity.HIGH, 500, "Internal server error"),
  SERVICE_UNAVAILABLE(
      "ServiceUnavailable",
      ErrorCategory.INTERNAL,
      ErrorSeverity.CRITICAL,
      503,
      "Service unavailable"),
  UNKNOWN("UnknownError", ErrorCategory.INTERNAL, ErrorSeverity.MEDIUM, null, "Unknown error");

  private final String code;
  private final ErrorCategory category;
  private final ErrorSeverity severity;
  private final Integer statusCode;
  private final String defaultMessage;

  McpErrorType(
      String code,
      ErrorCategory category,
      ErrorSeverity severity,
      Integer statusCode,
      String defaultMessage) {
    this.code = code;
    this.category = category;
    this.severity = severity;
    this.statusCode = statusCode;
    this.defaultMessage = defaultMessage;
  }

  public String getCode() {
    return code;
  }

  public ErrorCategory getCategory() {
    return category;
  }

  public ErrorSeverity getSeverity() {
    return severity;
  }

  /** Default HTTP status; {@code null} for failures that never reached an HTTP exchange. */
  public Integer getStatusCode() {
    return statusCode;
  }

  public String getDefaultMessage() {
    return defaultMessage;
  }
}
