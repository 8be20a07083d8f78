package io.b2mash.jasper.mcpserver.exception;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;

/** Error payload as returned by the report server. Kept verbatim for diagnostics. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JasperServerError(
    String errorCode,
    String message,
    List<String> parameters,
    String errorUid,
    Map<String, Object> properties) {

  public JasperServerError {
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
    properties = properties == null ? Map.of() : properties;
  }

  public JasperServerError(String errorCode, String message) {
    this(errorCode, message, List.of(), null, Map.of());
  }
}
