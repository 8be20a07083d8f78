package io.b2mash.jasper.mcpserver.execution;

public record FormatStatistics(
    long executions,
    long successes,
    long failures,
    double averageTimeMs,
    double averageSizeBytes) {}
