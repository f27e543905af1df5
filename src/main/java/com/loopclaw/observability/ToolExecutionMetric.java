package com.loopclaw.observability;

public record ToolExecutionMetric(
    String toolName,
    boolean success,
    double executionTime,
    long timestamp,
    String errorMessage
) {}
