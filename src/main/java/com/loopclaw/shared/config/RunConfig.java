package com.loopclaw.shared.config;

import com.loopclaw.approval.ApprovalMode;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

public record RunConfig(
    ApprovalMode approvalMode,
    int maxIterations,
    Duration timeoutPerIteration,
    Set<String> allowedTools,
    Set<String> blockedTools,
    boolean enableTools
) {
    public static final int MAX_ITERATIONS_LIMIT = 50;

    public RunConfig {
        Objects.requireNonNull(approvalMode, "approvalMode");
        Objects.requireNonNull(timeoutPerIteration, "timeoutPerIteration");
        if (maxIterations < 1 || maxIterations > MAX_ITERATIONS_LIMIT) {
            throw new IllegalArgumentException(
                    "maxIterations must be between 1 and " + MAX_ITERATIONS_LIMIT + ": " + maxIterations);
        }
        if (timeoutPerIteration.isNegative() || timeoutPerIteration.isZero()) {
            throw new IllegalArgumentException("timeoutPerIteration must be positive");
        }
        allowedTools = allowedTools == null ? Set.of() : Set.copyOf(allowedTools);
        blockedTools = blockedTools == null ? Set.of() : Set.copyOf(blockedTools);
    }

    public static RunConfig defaults() {
        return new RunConfig(ApprovalMode.MANUAL, 10, Duration.ofSeconds(300), Set.of(), Set.of(), true);
    }

    public RunConfig withApprovalMode(ApprovalMode mode) {
        return new RunConfig(mode, maxIterations, timeoutPerIteration, allowedTools, blockedTools, enableTools);
    }

    public RunConfig withMaxIterations(int max) {
        return new RunConfig(approvalMode, max, timeoutPerIteration, allowedTools, blockedTools, enableTools);
    }

    public RunConfig withTimeoutPerIteration(Duration timeout) {
        return new RunConfig(approvalMode, maxIterations, timeout, allowedTools, blockedTools, enableTools);
    }

    public RunConfig withAllowedTools(Set<String> tools) {
        return new RunConfig(approvalMode, maxIterations, timeoutPerIteration, tools, blockedTools, enableTools);
    }

    public RunConfig withBlockedTools(Set<String> tools) {
        return new RunConfig(approvalMode, maxIterations, timeoutPerIteration, allowedTools, tools, enableTools);
    }

    public RunConfig withEnableTools(boolean enabled) {
        return new RunConfig(approvalMode, maxIterations, timeoutPerIteration, allowedTools, blockedTools, enabled);
    }

    public boolean toolsDisabled() {
        return !enableTools || approvalMode == ApprovalMode.DISABLED;
    }
}
