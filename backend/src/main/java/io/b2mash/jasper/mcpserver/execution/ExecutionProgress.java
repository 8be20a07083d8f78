package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.jasper.RemoteExecutionDetails;
import io.b2mash.jasper.mcpserver.jasper.RemoteExecutionStatus;
import java.util.List;

/** Latest progress the report server reported for an asynchronous execution. */
public record ExecutionProgress(
    int progress,
    Integer currentPage,
    Integer totalPages,
    List<RemoteExecutionDetails.Export> exports) {

  public ExecutionProgress {
    exports = exports == null ? List.of() : List.copyOf(exports);
  }

  static ExecutionProgress of(RemoteExecutionStatus status) {
    return new ExecutionProgress(
        status.progress() == null ? 0 : status.progress(),
        status.currentPage(),
        status.totalPages(),
        status.exports());
  }

  /** Progress of a finished execution, taken from its details where they are present. */
  ExecutionProgress completedWith(RemoteExecutionDetails details) {
    return new ExecutionProgress(
        100,
        currentPage,
        details.totalPages() != null ? details.totalPages() : totalPages,
        details.exports().isEmpty() ? exports : details.exports());
  }
}
