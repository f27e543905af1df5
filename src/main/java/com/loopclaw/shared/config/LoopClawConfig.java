package com.loopclaw.shared.config;

import java.nio.file.Path;

public record LoopClawConfig(
    String model,
    String workDir,
    Path metricsFile,
    RunConfig agent
) {}
