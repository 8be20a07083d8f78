package io.b2mash.jasper.mcpserver.jasper;

import io.b2mash.jasper.mcpserver.format.OutputFormatDescriptor;
import java.util.Map;

/**
 * Port to the report server's execution services. Implementations surface non-2xx responses and
 * I/O failures as Spring {@code RestClientException}s, untranslated; callers map them.
 *
 * <p>{@code parameters} are already transformed: every value is a string or a list of strings.
 */
public interface ReportExecutionClient {

  /** Renders a report in one blocking round trip. */
  RenderedReport runReport(
      String reportUri,
      OutputFormatDescriptor format,
      Map<String, Object> parameters,
      ReportRunOptions options);

  /** Submits an asynchronous execution and returns the server's handle without waiting. */
  RemoteExecution startExecution(
      String reportUri,
      OutputFormatDescriptor format,
      Map<String, Object> parameters,
      ReportRunOptions options);

  RemoteExecutionStatus getExecutionStatus(String requestId);

  RemoteExecutionDetails getExecutionDetails(String requestId);

  RenderedReport getExportOutput(String requestId, String exportId);

  /**
   * Requests cancellation of a server-side execution.
   *
   * @return false when the server reports the execution as already finished or unknown
   */
  boolean cancelExecution(String requestId);
}
