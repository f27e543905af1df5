package com.loopclaw.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

public class ToolMetricsTracker implements ToolMetrics {

    private static final Logger log = LoggerFactory.getLogger(ToolMetricsTracker.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final ConcurrentLinkedQueue<ToolExecutionMetric> metrics = new ConcurrentLinkedQueue<>();
    private final Clock clock;

    public ToolMetricsTracker() {
        this(Clock.systemUTC());
    }

    public ToolMetricsTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void record(String toolName, boolean success, Duration elapsed, String errorMessage) {
        metrics.add(new ToolExecutionMetric(toolName, success, elapsed.toNanos() / 1_000_000_000.0,
                clock.millis(), errorMessage));
    }

    public Optional<ToolStats> toolStats(String toolName) {
        var runs = metrics.stream().filter(m -> m.toolName().equals(toolName)).toList();
        if (runs.isEmpty()) return Optional.empty();

        int total = runs.size();
        int ok = (int) runs.stream().filter(ToolExecutionMetric::success).count();
        double totalTime = runs.stream().mapToDouble(ToolExecutionMetric::executionTime).sum();
        long lastUsed = runs.stream().mapToLong(ToolExecutionMetric::timestamp).max().orElse(0);
        return Optional.of(new ToolStats(toolName, total, ok, total - ok, totalTime,
                totalTime / total, (double) ok / total, lastUsed));
    }

    public List<ToolStats> allStats() {
        return metrics.stream()
                .map(ToolExecutionMetric::toolName)
                .distinct()
                .map(this::toolStats)
                .flatMap(Optional::stream)
                .sorted(Comparator.comparingInt(ToolStats::totalExecutions).reversed())
                .toList();
    }

    // newest first
    public List<ToolExecutionMetric> recentExecutions(int limit) {
        var snapshot = new ArrayList<>(metrics);
        Collections.reverse(snapshot);
        return snapshot.stream().limit(limit).toList();
    }

    public int totalExecutions() {
        return metrics.size();
    }

    public double successRate() {
        var snapshot = List.copyOf(metrics);
        if (snapshot.isEmpty()) return 0.0;
        return (double) snapshot.stream().filter(ToolExecutionMetric::success).count() / snapshot.size();
    }

    public List<Map.Entry<String, Long>> mostUsedTools(int limit) {
        Map<String, Long> counts = metrics.stream()
                .collect(Collectors.groupingBy(ToolExecutionMetric::toolName, LinkedHashMap::new,
                        Collectors.counting()));
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .map(e -> Map.entry(e.getKey(), e.getValue()))
                .toList();
    }

    public List<Map.Entry<String, Double>> fastestTools(int limit) {
        return allStats().stream()
                .sorted(Comparator.comparingDouble(ToolStats::averageExecutionTime))
                .limit(limit)
                .map(s -> Map.entry(s.toolName(), s.averageExecutionTime()))
                .toList();
    }

    public void clear() {
        metrics.clear();
    }

    public void save(Path file) {
        var data = new LinkedHashMap<String, Object>();
        data.put("metrics", new ArrayList<>(metrics));
        data.put("last_updated", clock.millis());
        try {
            if (file.getParent() != null) Files.createDirectories(file.getParent());
            MAPPER.writeValue(file.toFile(), data);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save tool metrics: " + file, e);
        }
    }

    /** Replaces the current log with the file's contents. A missing or corrupt file leaves it empty. */
    public void load(Path file) {
        metrics.clear();
        if (!Files.exists(file)) return;
        try {
            var root = MAPPER.readTree(file.toFile());
            List<ToolExecutionMetric> loaded = MAPPER.convertValue(root.path("metrics"),
                    new TypeReference<List<ToolExecutionMetric>>() {});
            if (loaded != null) metrics.addAll(loaded);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Could not load tool metrics from {}: {}", file, e.getMessage());
        }
    }
}
