package io.b2mash.jasper.mcpserver.execution;

/**
 * Outcome of {@link ExecutionTracker#cleanupOldExecutions}.
 *
 * @param removedExecutions finished executions dropped from history
 * @param expiredExecutions open asynchronous executions failed because they exceeded the age limit
 */
public record ExecutionCleanupResult(int removedExecutions, int expiredExecutions) {}
