package com.loopclaw.observability;

// times in seconds, lastUsed in epoch millis
public record ToolStats(
    String toolName,
    int totalExecutions,
    int successfulExecutions,
    int failedExecutions,
    double totalExecutionTime,
    double averageExecutionTime,
    double successRate,
    long lastUsed
) {}
