package com.loopclaw.agent;

import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;

// toolCallsMade and toolResults are index-aligned
public record AgentResult(
    String finalResponse,
    int iterations,
    List<ToolCall> toolCallsMade,
    List<ToolResult> toolResults,
    String error,
    StopReason stoppedReason,
    List<Map<String, Object>> conversation
) {
    public AgentResult {
        Objects.requireNonNull(stoppedReason, "stoppedReason");
        finalResponse = finalResponse != null ? finalResponse : "";
        toolCallsMade = List.copyOf(toolCallsMade);
        toolResults = List.copyOf(toolResults);
        conversation = conversation != null ? List.copyOf(conversation) : List.of();
    }

    public static AgentResult completed(String finalResponse, int iterations, List<ToolCall> calls,
                                        List<ToolResult> results, List<Map<String, Object>> conversation) {
        return new AgentResult(finalResponse, iterations, calls, results, null, StopReason.COMPLETED, conversation);
    }

    public static AgentResult stopped(StopReason reason, String error, int iterations, List<ToolCall> calls,
                                      List<ToolResult> results, List<Map<String, Object>> conversation) {
        return new AgentResult("", iterations, calls, results, error, reason, conversation);
    }

    public boolean success() {
        return stoppedReason == StopReason.COMPLETED;
    }
}
