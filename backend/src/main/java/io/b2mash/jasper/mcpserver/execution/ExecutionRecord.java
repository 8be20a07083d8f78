package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.exception.NormalizedError;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one execution as held by {@link ExecutionTracker}. Open records move through the
 * non-terminal states; once a terminal state is reached the record is never replaced again.
 *
 * <p>{@code progress} is only set once an asynchronous execution has been polled.
 */
public record ExecutionRecord(
    String executionId,
    ExecutionMode mode,
    String reportUri,
    String outputFormat,
    Map<String, Object> parameters,
    ExecutionState state,
    String remoteRequestId,
    ExecutionProgress progress,
    Instant startedAt,
    Instant finishedAt,
    boolean success,
    String fileName,
    String contentType,
    long fileSize,
    String exportId,
    String errorCode,
    String errorMessage) {

  static ExecutionRecord open(
      String executionId, ExecutionMode mode, ExecutionRequest request, Instant startedAt) {
    return new ExecutionRecord(
        executionId,
        mode,
        request.reportUri(),
        request.outputFormat(),
        request.parameters(),
        ExecutionState.RESOLVING_RESOURCE,
        null,
        null,
        startedAt,
        null,
        false,
        null,
        null,
        0,
        null,
        null,
        null);
  }

  ExecutionRecord withState(ExecutionState newState) {
    return new ExecutionRecord(
        executionId, mode, reportUri, outputFormat, parameters, newState, remoteRequestId,
        progress, startedAt, finishedAt, success, fileName, contentType, fileSize, exportId,
        errorCode, errorMessage);
  }

  ExecutionRecord withRemoteRequestId(String requestId) {
    return new ExecutionRecord(
        executionId, mode, reportUri, outputFormat, parameters, state, requestId, progress,
        startedAt, finishedAt, success, fileName, contentType, fileSize, exportId, errorCode,
        errorMessage);
  }

  ExecutionRecord withProgress(ExecutionProgress newProgress) {
    return new ExecutionRecord(
        executionId, mode, reportUri, outputFormat, parameters, state, remoteRequestId,
        newProgress, startedAt, finishedAt, success, fileName, contentType, fileSize, exportId,
        errorCode, errorMessage);
  }

  ExecutionRecord completed(ExecutionOutput output, Instant at) {
    return new ExecutionRecord(
        executionId, mode, reportUri, outputFormat, parameters, ExecutionState.READY,
        remoteRequestId, progress, startedAt, at, true, output.fileName(), output.contentType(),
        output.fileSize(), output.exportId(), null, null);
  }

  ExecutionRecord failed(NormalizedError error, Instant at) {
    return new ExecutionRecord(
        executionId, mode, reportUri, outputFormat, parameters, ExecutionState.FAILED,
        remoteRequestId, progress, startedAt, at, false, null, null, 0, null, error.code(),
        error.message());
  }

  ExecutionRecord cancelled(Instant at) {
    return new ExecutionRecord(
        executionId, mode, reportUri, outputFormat, parameters, ExecutionState.CANCELLED,
        remoteRequestId, progress, startedAt, at, false, null, null, 0, null, "Cancelled",
        "Execution cancelled");
  }

  /** Wall-clock duration, or {@code null} while the execution is still open. */
  public Long executionTimeMs() {
    return finishedAt == null ? null : Duration.between(startedAt, finishedAt).toMillis();
  }
}
