package com.loopclaw.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class MicrometerToolMetrics implements ToolMetrics {

    static final String EXECUTIONS = "loopclaw.tool.executions";
    static final String LATENCY = "loopclaw.tool.latency";

    private final MeterRegistry registry;

    public MicrometerToolMetrics() {
        this(new SimpleMeterRegistry());
    }

    public MicrometerToolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    @Override
    public void record(String toolName, boolean success, Duration elapsed, String errorMessage) {
        executions(toolName, success).increment();
        latency(toolName).record(elapsed);
    }

    public Counter executions(String toolName, boolean success) {
        return Counter.builder(EXECUTIONS)
                .tag("tool", toolName)
                .tag("outcome", success ? "success" : "error")
                .register(registry);
    }

    public Timer latency(String toolName) {
        return Timer.builder(LATENCY).tag("tool", toolName).register(registry);
    }
}
