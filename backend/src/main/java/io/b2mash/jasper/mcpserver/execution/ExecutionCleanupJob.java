package io.b2mash.jasper.mcpserver.execution;

import io.b2mash.jasper.mcpserver.config.JasperServerProperties;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled cleanup of the execution registry. Drops finished executions older than {@code
 * jasper.execution.cleanup-max-age} and expires asynchronous executions nobody polled to the end.
 */
@Component
public class ExecutionCleanupJob {

  private static final Logger log = LoggerFactory.getLogger(ExecutionCleanupJob.class);

  private final ReportExecutionService reportExecutionService;
  private final Duration maxAge;

  public ExecutionCleanupJob(
      ReportExecutionService reportExecutionService, JasperServerProperties properties) {
    this.reportExecutionService = reportExecutionService;
    this.maxAge = properties.execution().cleanupMaxAge();
  }

  @Scheduled(
      fixedRateString = "${jasper.execution.cleanup-interval:PT1H}",
      initialDelayString = "${jasper.execution.cleanup-interval:PT1H}")
  public void cleanupOldExecutions() {
    try {
      var result = reportExecutionService.cleanupOldExecutions(maxAge);
      log.debug(
          "Execution cleanup removed {} and expired {} executions",
          result.removedExecutions(),
          result.expiredExecutions());
    } catch (RuntimeException e) {
      log.warn("Execution cleanup failed: {}", e.getMessage());
    }
  }
}
