package com.loopclaw.observability;

import java.time.Duration;

public interface ToolMetrics {

    ToolMetrics NOOP = (toolName, success, elapsed, errorMessage) -> { };

    void record(String toolName, boolean success, Duration elapsed, String errorMessage);
}
