package io.b2mash.jasper.mcpserver.tool;

import io.b2mash.jasper.mcpserver.execution.AsyncExecutionResponse;
import io.b2mash.jasper.mcpserver.execution.ExecutionCleanupResult;
import io.b2mash.jasper.mcpserver.execution.ExecutionRecord;
import io.b2mash.jasper.mcpserver.execution.ExecutionRequest;
import io.b2mash.jasper.mcpserver.execution.ExecutionResult;
import io.b2mash.jasper.mcpserver.execution.ExecutionStatistics;
import io.b2mash.jasper.mcpserver.execution.ReportExecutionService;
import io.b2mash.jasper.mcpserver.execution.ReportMetadata;
import io.b2mash.jasper.mcpserver.execution.ReportValidationResult;
import io.b2mash.jasper.mcpserver.format.OutputFormatDescriptor;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** HTTP surface of the report tools. One endpoint per tool call. */
@RestController
@RequestMapping("/api/reports")
public class ReportToolController {

  private final ReportExecutionService reportExecutionService;

  public ReportToolController(ReportExecutionService reportExecutionService) {
    this.reportExecutionService = reportExecutionService;
  }

  @PostMapping("/executions/sync")
  public ResponseEntity<ExecutionResult> runReportSync(
      @Valid @RequestBody ExecutionRequest request) {
    return ResponseEntity.ok(reportExecutionService.runReportSync(request));
  }

  @PostMapping("/executions")
  public ResponseEntity<AsyncExecutionResponse> runReportAsync(
      @Valid @RequestBody ExecutionRequest request) {
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(reportExecutionService.runReportAsync(request));
  }

  @GetMapping("/executions/active")
  public ResponseEntity<List<ExecutionRecord>> getActiveExecutions() {
    return ResponseEntity.ok(reportExecutionService.getActiveExecutions());
  }

  @GetMapping("/executions/statistics")
  public ResponseEntity<ExecutionStatistics> getExecutionStatistics() {
    return ResponseEntity.ok(reportExecutionService.getExecutionStatistics());
  }

  @GetMapping("/executions/history")
  public ResponseEntity<List<ExecutionRecord>> getExecutionHistory(
      @RequestParam(required = false) Integer limit) {
    var history =
        limit == null
            ? reportExecutionService.getExecutionHistory()
            : reportExecutionService.getExecutionHistory(limit);
    return ResponseEntity.ok(history);
  }

  @DeleteMapping("/executions/history")
  public ResponseEntity<Void> clearExecutionHistory() {
    reportExecutionService.clearExecutionHistory();
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/executions/cleanup")
  public ResponseEntity<ExecutionCleanupResult> cleanupOldExecutions(
      @RequestParam(defaultValue = "86400000") long maxAgeMs) {
    return ResponseEntity.ok(
        reportExecutionService.cleanupOldExecutions(Duration.ofMillis(maxAgeMs)));
  }

  @GetMapping("/executions/{executionId}")
  public ResponseEntity<ExecutionRecord> getExecutionStatus(@PathVariable String executionId) {
    return ResponseEntity.ok(reportExecutionService.getExecutionStatus(executionId));
  }

  @GetMapping("/executions/{executionId}/result")
  public ResponseEntity<ExecutionResult> getExecutionResult(
      @PathVariable String executionId, @RequestParam(required = false) String exportId) {
    return ResponseEntity.ok(reportExecutionService.getExecutionResult(executionId, exportId));
  }

  @PostMapping("/executions/{executionId}/cancel")
  public ResponseEntity<CancelExecutionResponse> cancelExecution(
      @PathVariable String executionId) {
    boolean cancelled = reportExecutionService.cancelExecution(executionId);
    return ResponseEntity.ok(new CancelExecutionResponse(executionId, cancelled));
  }

  @GetMapping("/validate")
  public ResponseEntity<ReportValidationResult> validateReport(@RequestParam String reportUri) {
    return ResponseEntity.ok(reportExecutionService.validateReport(reportUri));
  }

  @GetMapping("/metadata")
  public ResponseEntity<ReportMetadata> getReportMetadata(@RequestParam String reportUri) {
    return ResponseEntity.ok(reportExecutionService.getReportMetadata(reportUri));
  }

  @GetMapping("/formats")
  public ResponseEntity<List<OutputFormatDescriptor>> getSupportedFormats() {
    return ResponseEntity.ok(reportExecutionService.getSupportedFormats());
  }
}
