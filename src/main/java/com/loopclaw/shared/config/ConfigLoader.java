package com.loopclaw.shared.config;

import com.loopclaw.approval.ApprovalMode;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".loopclaw", "config.yaml"
    );

    public static LoopClawConfig load() {
        return load(DEFAULT_PATH);
    }

    public static LoopClawConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static LoopClawConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var agent = (Map<String, Object>) raw.getOrDefault("agent", Map.of());
        if (agent == null) agent = Map.of();

        var metricsFile = raw.get("metrics-file");
        return new LoopClawConfig(
            envOrDefault(env, "LOOPCLAW_MODEL", (String) raw.get("model")),
            envOrDefault(env, "LOOPCLAW_WORK_DIR",
                String.valueOf(raw.getOrDefault("work-dir", System.getProperty("user.dir")))),
            metricsFile != null ? Path.of(String.valueOf(metricsFile)) : null,
            parseRunConfig(agent, env)
        );
    }

    private static RunConfig parseRunConfig(Map<String, Object> agent, Function<String, String> env) {
        var defaults = RunConfig.defaults();
        var mode = envOrDefault(env, "LOOPCLAW_APPROVAL_MODE",
            String.valueOf(agent.getOrDefault("approval-mode", defaults.approvalMode().value())));
        var maxIterations = envOrDefault(env, "LOOPCLAW_MAX_ITERATIONS",
            String.valueOf(agent.getOrDefault("max-iterations", defaults.maxIterations())));
        var timeoutSeconds = Double.parseDouble(String.valueOf(
            agent.getOrDefault("timeout-per-iteration", defaults.timeoutPerIteration().toSeconds())));

        return new RunConfig(
            ApprovalMode.fromString(mode),
            Integer.parseInt(maxIterations.strip()),
            Duration.ofNanos((long) (timeoutSeconds * 1_000_000_000L)),
            toNames(agent.get("allowed-tools")),
            toNames(agent.get("blocked-tools")),
            Boolean.parseBoolean(String.valueOf(agent.getOrDefault("enable-tools", defaults.enableTools())))
        );
    }

    private static Set<String> toNames(Object value) {
        if (value == null) return Set.of();
        if (value instanceof Collection<?> items) {
            return items.stream().map(String::valueOf).collect(Collectors.toSet());
        }
        throw new IllegalArgumentException("Expected a list of tool names but got: " + value);
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null && !val.isBlank() ? val : fallback;
    }
}
