package io.b2mash.jasper.mcpserver.jasper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.b2mash.jasper.mcpserver.exception.JasperServerError;
import java.util.List;

/**
 * Status of a server-side execution.
 *
 * @param value one of {@code queued}, {@code execution}, {@code ready}, {@code failed}, {@code
 *     cancelled}
 * @param errorDescriptor set when {@code value} is {@code failed}
 * @param progress completion percentage, when the server reports one
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteExecutionStatus(
    String value,
    JasperServerError errorDescriptor,
    Integer progress,
    Integer currentPage,
    Integer totalPages,
    List<RemoteExecutionDetails.Export> exports) {

  public static final String READY = "ready";
  public static final String FAILED = "failed";
  public static final String CANCELLED = "cancelled";

  public RemoteExecutionStatus {
    exports = exports == null ? List.of() : List.copyOf(exports);
  }

  public RemoteExecutionStatus(String value, JasperServerError errorDescriptor) {
    this(value, errorDescriptor, null, null, null, null);
  }
}
