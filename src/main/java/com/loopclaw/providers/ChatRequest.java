package com.loopclaw.providers;

import com.loopclaw.tools.ToolDefinition;

import java.util.List;
import java.util.Map;

public record ChatRequest(
    String model,
    List<Map<String, Object>> messages,
    List<ToolDefinition> tools
) {
    public ChatRequest {
        messages = List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public ChatRequest(String model, List<Map<String, Object>> messages) {
        this(model, messages, List.of());
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
