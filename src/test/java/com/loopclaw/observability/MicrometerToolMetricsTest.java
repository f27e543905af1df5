package com.loopclaw.observability;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerToolMetricsTest {

    @Test
    void countsByToolAndOutcome() {
        var metrics = new MicrometerToolMetrics();
        metrics.record("shell", true, Duration.ofMillis(10), null);
        metrics.record("shell", true, Duration.ofMillis(30), null);
        metrics.record("shell", false, Duration.ofMillis(5), "boom");

        assertEquals(2.0, metrics.executions("shell", true).count());
        assertEquals(1.0, metrics.executions("shell", false).count());
        assertEquals(3, metrics.latency("shell").count());
        assertEquals(45.0, metrics.latency("shell").totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    void metersAreRegistered() {
        var metrics = new MicrometerToolMetrics();
        metrics.record("file_read", true, Duration.ofMillis(1), null);

        assertNotNull(metrics.registry().find(MicrometerToolMetrics.EXECUTIONS).tag("tool", "file_read").counter());
        assertNotNull(metrics.registry().find(MicrometerToolMetrics.LATENCY).timer());
    }
}
