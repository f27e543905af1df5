package com.loopclaw.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Map;

/**
 * Raw completion. {@code content} keeps the backend's shape: a JSON string for
 * plain answers or an array of content blocks. Only a
 * {@link com.loopclaw.agent.ResponseParser} looks inside it.
 */
public record ChatResponse(
    String model,
    JsonNode content,
    String stopReason,
    Map<String, Integer> usage
) {
    public ChatResponse {
        content = content != null ? content : JsonNodeFactory.instance.nullNode();
        usage = usage != null ? Map.copyOf(usage) : Map.of();
    }

    public ChatResponse(JsonNode content) {
        this(null, content, null, Map.of());
    }

    public static ChatResponse text(String text) {
        return new ChatResponse(JsonNodeFactory.instance.textNode(text));
    }
}
