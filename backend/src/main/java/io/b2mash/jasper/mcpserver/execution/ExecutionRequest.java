package io.b2mash.jasper.mcpserver.execution;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A report-run request. {@code pages}, {@code locale} and {@code timezone} are optional; the three
 * flags only affect asynchronous runs.
 */
public record ExecutionRequest(
    @NotBlank(message = "reportUri is required") String reportUri,
    @NotBlank(message = "outputFormat is required") String outputFormat,
    Map<String, Object> parameters,
    @Pattern(
            regexp = ExecutionRequest.PAGE_RANGE_PATTERN,
            message = "Invalid page range format. Use formats like \"1-5\", \"1,3,5\", or \"1-3,7-10\"")
        String pages,
    String locale,
    String timezone,
    Boolean freshData,
    Boolean saveDataSnapshot,
    Boolean ignorePagination) {

  static final String PAGE_RANGE_PATTERN = "^\\d+(-\\d+)?(,\\d+(-\\d+)?)*$";

  public ExecutionRequest {
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public ExecutionRequest(String reportUri, String outputFormat, Map<String, Object> parameters) {
    this(reportUri, outputFormat, parameters, null, null, null, null, null, null);
  }

  ExecutionRequest withOutputFormat(String format) {
    return new ExecutionRequest(
        reportUri,
        format,
        parameters,
        pages,
        locale,
        timezone,
        freshData,
        saveDataSnapshot,
        ignorePagination);
  }
}
