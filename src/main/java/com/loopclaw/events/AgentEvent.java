package com.loopclaw.events;

import com.loopclaw.tools.ToolCall;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AgentEvent(
    EventType type,
    int iteration,
    String toolName,
    String toolCallId,
    String message,
    Map<String, Object> data,
    Instant timestamp
) {
    public AgentEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static AgentEvent of(EventType type, int iteration, String message) {
        return of(type, iteration, message, Map.of());
    }

    public static AgentEvent of(EventType type, int iteration, String message, Map<String, Object> data) {
        return new AgentEvent(type, iteration, null, null, message, data, Instant.now());
    }

    public static AgentEvent forTool(EventType type, int iteration, ToolCall call, String message) {
        return forTool(type, iteration, call, message, Map.of());
    }

    public static AgentEvent forTool(EventType type, int iteration, ToolCall call, String message,
                                     Map<String, Object> data) {
        return new AgentEvent(type, iteration, call.name(), call.id(), message, data, Instant.now());
    }

    public boolean isToolEvent() {
        return toolCallId != null;
    }
}
