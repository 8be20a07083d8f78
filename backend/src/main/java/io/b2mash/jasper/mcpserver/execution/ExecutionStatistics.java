package io.b2mash.jasper.mcpserver.execution;

import java.util.Map;

/**
 * Point-in-time view of the tracker counters. {@code cancelledExecutions} is a subset of {@code
 * failedExecutions}, so {@code totalExecutions == successfulExecutions + failedExecutions}.
 */
public record ExecutionStatistics(
    long totalExecutions,
    long successfulExecutions,
    long failedExecutions,
    long cancelledExecutions,
    int activeExecutions,
    double averageExecutionTimeMs,
    Map<String, FormatStatistics> formatStats) {}
