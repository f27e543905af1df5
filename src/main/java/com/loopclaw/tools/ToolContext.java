package com.loopclaw.tools;

public record ToolContext(String toolCallId, String workDir) {
}
