package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.config.JasperServerProperties;
import io.b2mash.jasper.mcpserver.exception.ErrorMapper;
import io.b2mash.jasper.mcpserver.exception.McpErrorType;
import io.b2mash.jasper.mcpserver.exception.McpException;
import io.b2mash.jasper.mcpserver.exception.NormalizedError;
import io.b2mash.jasper.mcpserver.format.OutputFormatDescriptor;
import io.b2mash.jasper.mcpserver.format.OutputFormatRegistry;
import io.b2mash.jasper.mcpserver.jasper.InputControl;
import io.b2mash.jasper.mcpserver.jasper.InputControlLookup;
import io.b2mash.jasper.mcpserver.jasper.RemoteExecutionDetails;
import io.b2mash.jasper.mcpserver.jasper.RemoteExecutionStatus;
import io.b2mash.jasper.mcpserver.jasper.RenderedReport;
import io.b2mash.jasper.mcpserver.jasper.ReportExecutionClient;
import io.b2mash.jasper.mcpserver.jasper.ReportRunOptions;
import io.b2mash.jasper.mcpserver.jasper.ResourceDescriptor;
import io.b2mash.jasper.mcpserver.jasper.ResourceLookup;
import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Runs reports on the report server, synchronously or as polled asynchronous jobs, and keeps the
 * {@link ExecutionTracker} in step with every outcome.
 *
 * <p>Local validation failures are raised before an execution is registered. Once registered,
 * every failure is mapped through {@link ErrorMapper}, recorded exactly once and rethrown as an
 * {@link McpException}.
 */
@Service
public class ReportExecutionService {

  private static final Logger log = LoggerFactory.getLogger(ReportExecutionService.class);

  private static final Pattern PAGE_RANGE = Pattern.compile(ExecutionRequest.PAGE_RANGE_PATTERN);

  private final ResourceLookup resourceLookup;
  private final InputControlLookup inputControlLookup;
  private final ReportExecutionClient executionClient;
  private final OutputFormatRegistry formatRegistry;
  private final ParameterTransformer parameterTransformer;
  private final ExecutionTracker tracker;
  private final ErrorMapper errorMapper;
  private final long maxFileSizeBytes;
  private final int maxConcurrentExecutions;

  @Autowired
  public ReportExecutionService(
      ResourceLookup resourceLookup,
      InputControlLookup inputControlLookup,
      ReportExecutionClient executionClient,
      OutputFormatRegistry formatRegistry,
      ParameterTransformer parameterTransformer,
      ExecutionTracker tracker,
      ErrorMapper errorMapper,
      JasperServerProperties properties) {
    this(
        resourceLookup,
        inputControlLookup,
        executionClient,
        formatRegistry,
        parameterTransformer,
        tracker,
        errorMapper,
        properties.execution().maxFileSize().toBytes(),
        properties.execution().maxConcurrentExecutions());
  }

  ReportExecutionService(
      ResourceLookup resourceLookup,
      InputControlLookup inputControlLookup,
      ReportExecutionClient executionClient,
      OutputFormatRegistry formatRegistry,
      ParameterTransformer parameterTransformer,
      ExecutionTracker tracker,
      ErrorMapper errorMapper,
      long maxFileSizeBytes,
      int maxConcurrentExecutions) {
    this.resourceLookup = resourceLookup;
    this.inputControlLookup = inputControlLookup;
    this.executionClient = executionClient;
    this.formatRegistry = formatRegistry;
    this.parameterTransformer = parameterTransformer;
    this.tracker = tracker;
    this.errorMapper = errorMapper;
    this.maxFileSizeBytes = maxFileSizeBytes;
    this.maxConcurrentExecutions = maxConcurrentExecutions;
  }

  public ExecutionResult runReportSync(ExecutionRequest request) {
    validateRequest(request);
    var format = formatRegistry.resolve(request.outputFormat());
    String executionId =
        tracker.begin(request.withOutputFormat(format.format()), ExecutionMode.SYNC);
    log.info(
        "Execution {} started: {} as {} (sync)", executionId, request.reportUri(), format.format());
    try {
      requireReportUnit(request.reportUri());
      tracker.transition(executionId, ExecutionState.TRANSFORMING_PARAMS);
      var parameters = parameterTransformer.transform(request.parameters());
      tracker.transition(executionId, ExecutionState.INVOKING);
      var rendered =
          executionClient.runReport(request.reportUri(), format, parameters, runOptions(request));

      byte[] content = contentOf(rendered);
      String contentType =
          rendered.contentType() != null ? rendered.contentType() : format.mimeType();
      String fileName = fileName(request.reportUri(), format);
      var output = new ExecutionOutput(fileName, contentType, content.length, null);
      long generationTimeMs =
          tracker.complete(executionId, output).map(ExecutionRecord::executionTimeMs).orElse(0L);
      log.info(
          "Execution {} ready: {} bytes in {} ms", executionId, content.length, generationTimeMs);
      return new ExecutionResult(
          true,
          executionId,
          ExecutionResult.STATUS_READY,
          format.format(),
          request.reportUri(),
          content,
          contentType,
          fileName,
          content.length,
          generationTimeMs,
          request.pages(),
          null);
    } catch (RuntimeException e) {
      throw failExecution(executionId, e, "Report execution");
    }
  }

  /**
   * Starts an asynchronous execution. At most {@code maxConcurrentExecutions} asynchronous
   * executions may be open at once; a start beyond that is rejected before registration.
   */
  public AsyncExecutionResponse runReportAsync(ExecutionRequest request) {
    validateRequest(request);
    var format = formatRegistry.resolveForAsync(request.outputFormat());
    String executionId =
        tracker
            .beginWithinLimit(
                request.withOutputFormat(format.format()),
                ExecutionMode.ASYNC,
                maxConcurrentExecutions)
            .orElseThrow(this::concurrencyLimitReached);
    log.info(
        "Execution {} started: {} as {} (async)",
        executionId,
        request.reportUri(),
        format.format());
    try {
      requireReportUnit(request.reportUri());
      tracker.transition(executionId, ExecutionState.TRANSFORMING_PARAMS);
      var parameters = parameterTransformer.transform(request.parameters());
      tracker.transition(executionId, ExecutionState.INVOKING);
      var remote =
          executionClient.startExecution(
              request.reportUri(), format, parameters, runOptions(request));
      tracker.attachRemoteRequest(executionId, remote.requestId());
      return AsyncExecutionResponse.pending(executionId);
    } catch (RuntimeException e) {
      throw failExecution(executionId, e, "Asynchronous report execution");
    }
  }

  /**
   * Returns the execution's record, first polling the report server when the execution is an open
   * asynchronous job. A failed poll is raised without finalizing the execution.
   */
  public ExecutionRecord getExecutionStatus(String executionId) {
    var record = requireExecution(executionId);
    if (record.state().isTerminal()
        || record.mode() == ExecutionMode.SYNC
        || record.remoteRequestId() == null) {
      return record;
    }

    tracker.transition(executionId, ExecutionState.POLLING);
    var status =
        callRemote(
            "Execution status poll",
            () -> executionClient.getExecutionStatus(record.remoteRequestId()));
    String value = status == null ? null : status.value();
    log.debug("Execution {} polled: remote status {}", executionId, value);
    var progress =
        status == null
            ? record.progress()
            : tracker
                .recordProgress(executionId, ExecutionProgress.of(status))
                .map(ExecutionRecord::progress)
                .orElse(null);

    if (RemoteExecutionStatus.READY.equals(value)) {
      var details =
          callRemote(
              "Execution details lookup",
              () -> executionClient.getExecutionDetails(record.remoteRequestId()));
      if (details != null) {
        var base = progress != null ? progress : new ExecutionProgress(0, null, null, null);
        tracker.recordProgress(executionId, base.completedWith(details));
      }
      return finalizeReady(record, details);
    }
    if (RemoteExecutionStatus.FAILED.equals(value)) {
      var error =
          status.errorDescriptor() != null
              ? errorMapper.mapJasperErrorToMcpError(status.errorDescriptor())
              : NormalizedError.of(
                  McpErrorType.INTERNAL,
                  "Report execution failed on the report server",
                  Map.of("requestId", record.remoteRequestId()));
      log.warn("Execution {} failed remotely: {}", executionId, error.message());
      return tracker.fail(executionId, error).orElseGet(() -> requireExecution(executionId));
    }
    if (RemoteExecutionStatus.CANCELLED.equals(value)) {
      log.info("Execution {} cancelled on the report server", executionId);
      return tracker.cancel(executionId).orElseGet(() -> requireExecution(executionId));
    }
    return requireExecution(executionId);
  }

  /** Downloads the first export of a ready asynchronous execution. */
  public ExecutionResult getExecutionResult(String executionId) {
    return getExecutionResult(executionId, null);
  }

  /**
   * Downloads an export of a ready asynchronous execution. Content is never cached.
   *
   * @param exportId export to download, or {@code null} for the one recorded at completion
   */
  public ExecutionResult getExecutionResult(String executionId, String exportId) {
    var record = requireExecution(executionId);
    if (record.state() != ExecutionState.READY) {
      throw new McpException(
          NormalizedError.of(
              McpErrorType.INVALID_REQUEST,
              "Execution "
                  + executionId
                  + " is not ready (status: "
                  + record.state().value()
                  + ")",
              Map.of("executionId", executionId, "status", record.state().value())));
    }
    if (record.remoteRequestId() == null) {
      throw new McpException(
          NormalizedError.of(
              McpErrorType.INVALID_REQUEST,
              "Output of synchronous execution " + executionId + " is returned by the run itself",
              Map.of("executionId", executionId)));
    }

    String requestedExport = exportId == null || exportId.isBlank() ? record.exportId() : exportId;
    var rendered =
        callRemote(
            "Execution output download",
            () -> executionClient.getExportOutput(record.remoteRequestId(), requestedExport));
    byte[] content = contentOf(rendered);
    return new ExecutionResult(
        true,
        executionId,
        ExecutionResult.STATUS_READY,
        record.outputFormat(),
        record.reportUri(),
        content,
        rendered.contentType() != null ? rendered.contentType() : record.contentType(),
        rendered.fileName() != null ? rendered.fileName() : record.fileName(),
        content.length,
        record.executionTimeMs() == null ? 0 : record.executionTimeMs(),
        null,
        requestedExport);
  }

  /**
   * Cancels an open asynchronous execution.
   *
   * @return false for synchronous, finished or unknown executions, and when the report server had
   *     already finished the job
   */
  public boolean cancelExecution(String executionId) {
    var found = tracker.find(executionId);
    if (found.isEmpty()) {
      log.debug("Cancel requested for unknown execution {}", executionId);
      return false;
    }
    var record = found.get();
    if (record.state().isTerminal()
        || record.mode() == ExecutionMode.SYNC
        || record.remoteRequestId() == null) {
      log.debug("Execution {} cannot be cancelled in state {}", executionId, record.state());
      return false;
    }

    boolean cancelled =
        callRemote(
            "Execution cancellation",
            () -> executionClient.cancelExecution(record.remoteRequestId()));
    if (!cancelled) {
      log.info("Report server had already finished execution {}", executionId);
      return false;
    }
    log.info("Execution {} cancelled", executionId);
    return tracker.cancel(executionId).isPresent();
  }

  /** Checks that {@code reportUri} names an executable report. Never throws. */
  public ReportValidationResult validateReport(String reportUri) {
    if (reportUri == null || reportUri.isBlank()) {
      return ReportValidationResult.invalid("reportUri is required");
    }
    try {
      var resource = resourceLookup.findResource(reportUri);
      if (resource.isEmpty()) {
        return ReportValidationResult.invalid(
            "Report not found or not accessible: " + reportUri);
      }
      if (!resource.get().isReportUnit()) {
        return ReportValidationResult.invalid(notAReportMessage(reportUri, resource.get()));
      }
      return ReportValidationResult.valid(resource.get());
    } catch (RuntimeException e) {
      var error = errorMapper.mapException(e, "Report validation");
      return ReportValidationResult.invalid(error.message());
    }
  }

  public ReportMetadata getReportMetadata(String reportUri) {
    requireReportUri(reportUri);
    var resource =
        callRemote("Report metadata lookup", () -> resourceLookup.findResource(reportUri))
            .orElseThrow(() -> reportNotFound(reportUri));

    List<InputControl> inputControls;
    try {
      inputControls = inputControlLookup.getInputControls(reportUri);
    } catch (RuntimeException e) {
      log.warn("Could not retrieve input controls for {}: {}", reportUri, e.getMessage());
      inputControls = List.of();
    }
    return new ReportMetadata(
        resource.uri(),
        resource.label(),
        resource.description(),
        resource.resourceType(),
        resource.creationDate(),
        resource.updateDate(),
        resource.version(),
        inputControls,
        formatRegistry.list());
  }

  public List<OutputFormatDescriptor> getSupportedFormats() {
    return formatRegistry.list();
  }

  public ExecutionStatistics getExecutionStatistics() {
    return tracker.getStatistics();
  }

  public List<ExecutionRecord> getActiveExecutions() {
    return tracker.getActiveExecutions();
  }

  public List<ExecutionRecord> getExecutionHistory() {
    return tracker.getExecutionHistory();
  }

  public List<ExecutionRecord> getExecutionHistory(int limit) {
    if (limit < 1) {
      throw new McpException(
          errorMapper.createValidationError(
              "limit", limit, "min:1", "limit must be a positive number"));
    }
    return tracker.getExecutionHistory(limit);
  }

  public void clearExecutionHistory() {
    tracker.clear();
  }

  /**
   * Drops finished executions older than {@code maxAge} and expires asynchronous executions that
   * stayed open longer than that.
   */
  public ExecutionCleanupResult cleanupOldExecutions(Duration maxAge) {
    if (maxAge == null || maxAge.isNegative() || maxAge.isZero()) {
      throw new McpException(
          errorMapper.createValidationError(
              "maxAgeMs",
              maxAge == null ? null : maxAge.toMillis(),
              "min:1",
              "maxAgeMs must be a positive number"));
    }
    return tracker.cleanupOldExecutions(maxAge);
  }

  private void validateRequest(ExecutionRequest request) {
    if (request == null) {
      throw new McpException(
          errorMapper.createValidationError(
              "request", null, "required", "Execution request is required"));
    }
    requireReportUri(request.reportUri());
    if (request.outputFormat() == null || request.outputFormat().isBlank()) {
      throw new McpException(
          errorMapper.createValidationError(
              "outputFormat", request.outputFormat(), "required", "outputFormat is required"));
    }
    if (request.pages() != null) {
      validatePages(request.pages());
    }
  }

  private void requireReportUri(String reportUri) {
    if (reportUri == null || reportUri.isBlank()) {
      throw new McpException(
          errorMapper.createValidationError(
              "reportUri", reportUri, "required", "reportUri is required"));
    }
    if (!reportUri.startsWith("/")) {
      throw new McpException(
          errorMapper.createValidationError(
              "reportUri",
              reportUri,
              "repository_path",
              "reportUri must be a repository path starting with '/'"));
    }
  }

  private void validatePages(String pages) {
    boolean valid = PAGE_RANGE.matcher(pages).matches();
    if (valid) {
      for (String range : pages.split(",")) {
        int dash = range.indexOf('-');
        if (dash > 0
            && new BigInteger(range.substring(0, dash))
                    .compareTo(new BigInteger(range.substring(dash + 1)))
                >= 0) {
          valid = false;
        }
      }
    }
    if (!valid) {
      throw new McpException(
          errorMapper.createValidationError(
              "pages",
              pages,
              "page_range",
              "Invalid page range format. Use formats like \"1-5\", \"1,3,5\", or \"1-3,7-10\""));
    }
  }

  private McpException concurrencyLimitReached() {
    int active = tracker.countActive(ExecutionMode.ASYNC);
    log.warn("Rejected asynchronous execution: {} executions already active", active);
    return new McpException(
        errorMapper.createValidationError(
            "concurrentExecutions",
            active,
            "<= " + maxConcurrentExecutions,
            "Maximum concurrent executions limit reached (" + maxConcurrentExecutions + ")"));
  }

  private void requireReportUnit(String reportUri) {
    var resource =
        resourceLookup.findResource(reportUri).orElseThrow(() -> reportNotFound(reportUri));
    if (!resource.isReportUnit()) {
      var details = new LinkedHashMap<String, Object>();
      details.put("reportUri", reportUri);
      details.put("resourceType", resource.resourceType());
      throw new McpException(
          NormalizedError.of(
              McpErrorType.INVALID_REQUEST, notAReportMessage(reportUri, resource), details));
    }
  }

  private ExecutionRecord finalizeReady(ExecutionRecord record, RemoteExecutionDetails details) {
    String executionId = record.executionId();
    if (details == null || details.exports().isEmpty()) {
      var error =
          NormalizedError.of(
              McpErrorType.INTERNAL,
              "Report server finished execution " + executionId + " without output",
              Map.of("requestId", record.remoteRequestId()));
      log.warn("Execution {} has no exports", executionId);
      return tracker.fail(executionId, error).orElseGet(() -> requireExecution(executionId));
    }

    var export = details.exports().get(0);
    var format = formatRegistry.resolveForAsync(record.outputFormat());
    var resource = export.outputResource();
    String contentType =
        resource != null && resource.contentType() != null
            ? resource.contentType()
            : format.mimeType();
    String fileName =
        resource != null && resource.fileName() != null
            ? resource.fileName()
            : fileName(record.reportUri(), format);
    log.info("Execution {} ready: export {}", executionId, export.id());
    // size is unknown until the output is downloaded
    return tracker
        .complete(executionId, new ExecutionOutput(fileName, contentType, 0, export.id()))
        .orElseGet(() -> requireExecution(executionId));
  }

  private McpException failExecution(String executionId, RuntimeException cause, String operation) {
    var error = errorMapper.mapException(cause, operation);
    tracker.fail(executionId, error);
    log.warn("Execution {} failed: {} ({})", executionId, error.message(), error.code());
    return cause instanceof McpException mcpException
        ? mcpException
        : new McpException(error, cause);
  }

  private <T> T callRemote(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (McpException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new McpException(errorMapper.mapException(e, operation), e);
    }
  }

  private byte[] contentOf(RenderedReport rendered) {
    byte[] content = rendered.content() == null ? new byte[0] : rendered.content();
    if (content.length > maxFileSizeBytes) {
      throw new McpException(
          errorMapper.createValidationError(
              "fileSize",
              content.length,
              "max:" + maxFileSizeBytes,
              "Report output of "
                  + content.length
                  + " bytes exceeds the maximum of "
                  + maxFileSizeBytes
                  + " bytes"));
    }
    return content;
  }

  private ExecutionRecord requireExecution(String executionId) {
    return tracker
        .find(executionId)
        .orElseThrow(
            () ->
                new McpException(
                    NormalizedError.of(
                        McpErrorType.RESOURCE_NOT_FOUND,
                        "Execution not found: " + executionId,
                        Map.of("executionId", String.valueOf(executionId)))));
  }

  private static McpException reportNotFound(String reportUri) {
    return new McpException(
        NormalizedError.of(
            McpErrorType.RESOURCE_NOT_FOUND,
            "Report not found: " + reportUri,
            Map.of("reportUri", reportUri)));
  }

  private static String notAReportMessage(String reportUri, ResourceDescriptor resource) {
    return "Resource at " + reportUri + " is not a report (type: " + resource.resourceType() + ")";
  }

  private static ReportRunOptions runOptions(ExecutionRequest request) {
    return new ReportRunOptions(
        request.pages(),
        request.locale(),
        request.timezone(),
        request.freshData(),
        request.saveDataSnapshot(),
        request.ignorePagination());
  }

  static String fileName(String reportUri, OutputFormatDescriptor format) {
    String name = reportUri.substring(reportUri.lastIndexOf('/') + 1);
    return (name.isEmpty() ? "report" : name) + "." + format.extension();
  }
}
