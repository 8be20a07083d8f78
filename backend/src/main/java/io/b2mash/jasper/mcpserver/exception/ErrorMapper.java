package io.b2mash.jasper.mcpserver.exception;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Converts every failure that can occur while talking to the report server into a {@link
 * NormalizedError}. Never fails to classify: unknown shapes degrade to {@code InternalError}.
 */
@Component
public class ErrorMapper {

  private static final Logger log = LoggerFactory.getLogger(ErrorMapper.class);

  private static final int MAX_BODY_IN_DETAILS = 2_000;

  /** Exact server error codes. Checked before {@link #PATTERN_RULES}. */
  private static final Map<String, Function<JasperServerError, NormalizedError>> SERVER_CODES =
      Map.ofEntries(
          Map.entry("resource.not.found", mapTo(McpErrorType.RESOURCE_NOT_FOUND)),
          Map.entry("access.denied", mapTo(McpErrorType.PERMISSION_DENIED)),
          Map.entry("invalid.credentials", mapTo(McpErrorType.AUTHENTICATION_REQUIRED)),
          Map.entry("resource.already.exists", mapTo(McpErrorType.RESOURCE_CONFLICT)),
          Map.entry("validation.error", ErrorMapper::serverValidationError),
          Map.entry("compilation.error", mapTo(McpErrorType.INVALID_REQUEST)),
          Map.entry("parameter.error", mapTo(McpErrorType.INVALID_REQUEST)),
          Map.entry(
              "datasource.error", mapTo(McpErrorType.INTERNAL, ErrorCategory.EXECUTION)),
          Map.entry("export.error", mapTo(McpErrorType.INTERNAL, ErrorCategory.EXECUTION)),
          Map.entry("job.not.found", mapTo(McpErrorType.RESOURCE_NOT_FOUND)),
          Map.entry("user.not.found", mapTo(McpErrorType.RESOURCE_NOT_FOUND)),
          Map.entry("role.not.found", mapTo(McpErrorType.RESOURCE_NOT_FOUND)),
          Map.entry("domain.not.found", mapTo(McpErrorType.RESOURCE_NOT_FOUND)));

  /** Substring fallback on the server error code. Order is the tie-break and must not change. */
  private static final List<PatternRule> PATTERN_RULES =
      List.of(
          new PatternRule(List.of("not.found"), McpErrorType.RESOURCE_NOT_FOUND),
          new PatternRule(List.of("access", "permission"), McpErrorType.PERMISSION_DENIED),
          new PatternRule(List.of("validation", "invalid"), McpErrorType.INVALID_REQUEST),
          new PatternRule(
              List.of("authentication", "credentials"), McpErrorType.AUTHENTICATION_REQUIRED));

  private final ObjectMapper objectMapper;

  public ErrorMapper(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public NormalizedError mapHttpStatusToMcpError(int statusCode, String message) {
    return mapHttpStatusToMcpError(statusCode, message, null);
  }

  public NormalizedError mapHttpStatusToMcpError(
      int statusCode, String message, Map<String, Object> details) {
    McpErrorType type =
        switch (statusCode) {
          case 400 -> McpErrorType.INVALID_REQUEST;
          case 401 -> McpErrorType.AUTHENTICATION_REQUIRED;
          case 403 -> McpErrorType.PERMISSION_DENIED;
          case 404 -> McpErrorType.RESOURCE_NOT_FOUND;
          case 408 -> McpErrorType.TIMEOUT;
          case 409 -> McpErrorType.RESOURCE_CONFLICT;
          case 500 -> McpErrorType.INTERNAL;
          case 503 -> McpErrorType.SERVICE_UNAVAILABLE;
          default -> McpErrorType.UNKNOWN;
        };
    return NormalizedError.of(type, message, details, statusCode);
  }

  public NormalizedError mapJasperErrorToMcpError(JasperServerError serverError) {
    String errorCode = serverError.errorCode();
    if (errorCode != null) {
      var exact = SERVER_CODES.get(errorCode);
      if (exact != null) {
        return exact.apply(serverError);
      }
      for (PatternRule rule : PATTERN_RULES) {
        if (rule.matches(errorCode)) {
          return NormalizedError.of(
              rule.type(), serverError.message(), Map.of("jasperError", serverError));
        }
      }
    }
    log.debug("Unrecognized server error code '{}', classifying as internal", errorCode);
    return NormalizedError.of(
        McpErrorType.INTERNAL, serverError.message(), Map.of("jasperError", serverError));
  }

  public NormalizedError createValidationError(List<FieldValidationError> fieldErrors) {
    return NormalizedError.of(
        McpErrorType.INVALID_PARAMS,
        "Validation failed for " + fieldErrors.size() + " field(s)",
        Map.of("validationResults", List.copyOf(fieldErrors)));
  }

  /** Single-field validation failure whose message is the field's own message. */
  public NormalizedError createValidationError(
      String field, Object value, String constraint, String message) {
    var details = new LinkedHashMap<String, Object>();
    details.put(
        "validationResults", List.of(new FieldValidationError(field, value, constraint, message)));
    return NormalizedError.of(McpErrorType.INVALID_PARAMS, message, details);
  }

  public NormalizedError createConnectionError(String cause, NetworkErrorDetails networkDetails) {
    var details = new LinkedHashMap<String, Object>();
    details.put("networkDetails", networkDetails);
    details.put("cause", cause);
    return NormalizedError.of(McpErrorType.CONNECTION, "Connection failed: " + cause, details);
  }

  public NormalizedError createConfigurationError(String configKey, String reason) {
    return createConfigurationError(configKey, reason, Map.of());
  }

  @SuppressWarnings("unchecked")
  public NormalizedError createConfigurationError(
      String configKey, String reason, Map<String, Object> extraDetails) {
    var extra = extraDetails == null ? Map.<String, Object>of() : extraDetails;
    var configDetails =
        new ConfigurationErrorDetails(
            configKey,
            extra.get("configValue"),
            (String) extra.get("expectedType"),
            (List<String>) extra.get("validValues"),
            reason);
    return NormalizedError.of(
        McpErrorType.INVALID_REQUEST,
        ErrorCategory.VALIDATION,
        "Configuration error for " + configKey + ": " + reason,
        Map.of("configDetails", configDetails),
        McpErrorType.INVALID_REQUEST.getStatusCode());
  }

  /**
   * Maps any exception raised while performing {@code operation} against the report server. An
   * {@link McpException} is returned unchanged.
   */
  public NormalizedError mapException(Throwable ex, String operation) {
    if (ex instanceof McpException mcpException) {
      return mcpException.getError();
    }
    if (ex instanceof RestClientResponseException responseException) {
      return mapResponseException(responseException, operation);
    }
    if (ex instanceof ResourceAccessException accessException) {
      return mapAccessException(accessException, operation);
    }
    log.error("{} failed unexpectedly", operation, ex);
    var details = new LinkedHashMap<String, Object>();
    details.put("operation", operation);
    details.put("originalError", String.valueOf(ex.getMessage()));
    return NormalizedError.of(
        McpErrorType.INTERNAL, operation + " failed: " + ex.getMessage(), details);
  }

  private NormalizedError mapResponseException(RestClientResponseException ex, String operation) {
    int status = ex.getStatusCode().value();
    String body = ex.getResponseBodyAsString();
    var serverError = parseServerError(body);
    if (serverError != null) {
      log.warn(
          "{} rejected by report server: status={}, errorCode={}",
          operation,
          status,
          serverError.errorCode());
      return mapJasperErrorToMcpError(serverError);
    }
    log.warn("{} failed with HTTP status {}", operation, status);
    var details = new LinkedHashMap<String, Object>();
    details.put("operation", operation);
    if (!body.isBlank()) {
      details.put(
          "responseBody",
          body.length() > MAX_BODY_IN_DETAILS ? body.substring(0, MAX_BODY_IN_DETAILS) : body);
    }
    return mapHttpStatusToMcpError(
        status, operation + " failed: HTTP " + status + " " + ex.getStatusText(), details);
  }

  private NormalizedError mapAccessException(ResourceAccessException ex, String operation) {
    Throwable cause = ex;
    while (cause.getCause() != null && cause.getCause() != cause) {
      cause = cause.getCause();
      if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
        log.warn("{} timed out: {}", operation, cause.getMessage());
        return NormalizedError.of(
            McpErrorType.TIMEOUT,
            operation + " timed out",
            Map.of("networkDetails", new NetworkErrorDetails(null, null, null, "timeout")));
      }
    }
    String reason;
    if (cause instanceof ConnectException) {
      reason = "connection_refused";
    } else if (cause instanceof UnknownHostException) {
      reason = "dns_error";
    } else {
      reason = "io_error";
    }
    log.warn("{} could not reach the report server: {}", operation, cause.getMessage());
    String message = cause.getMessage() != null ? cause.getMessage() : reason;
    return createConnectionError(message, new NetworkErrorDetails(null, null, null, reason));
  }

  private JasperServerError parseServerError(String body) {
    if (body == null || body.isBlank() || !body.trim().startsWith("{")) {
      return null;
    }
    try {
      var parsed = objectMapper.readValue(body, JasperServerError.class);
      return parsed.errorCode() != null ? parsed : null;
    } catch (JacksonException e) {
      log.debug("Error body is not a server error payload: {}", e.getMessage());
      return null;
    }
  }

  private static Function<JasperServerError, NormalizedError> mapTo(McpErrorType type) {
    return mapTo(type, type.getCategory());
  }

  private static Function<JasperServerError, NormalizedError> mapTo(
      McpErrorType type, ErrorCategory category) {
    return serverError ->
        NormalizedError.of(
            type,
            category,
            serverError.message(),
            Map.of("jasperError", serverError),
            type.getStatusCode());
  }

  private static NormalizedError serverValidationError(JasperServerError serverError) {
    var fieldErrors =
        serverError.parameters().stream()
            .map(
                parameter ->
                    new FieldValidationError(
                        parameter, null, "server_validation", serverError.message()))
            .toList();
    var details = new LinkedHashMap<String, Object>();
    details.put("validationResults", fieldErrors);
    details.put("jasperError", serverError);
    return NormalizedError.of(McpErrorType.INVALID_PARAMS, serverError.message(), details);
  }

  private record PatternRule(List<String> fragments, McpErrorType type) {

    boolean matches(String errorCode) {
      return fragments.stream().anyMatch(errorCode::contains);
    }
  }
}
