package com.loopclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.loopclaw.approval.DangerousOperation;

/**
 * A capability the model can invoke by name.
 * <p>
 * Implementations report foreseeable failures through {@link ToolResult#failure}
 * instead of throwing. The agent loop still catches anything that escapes.
 */
public interface Tool {
    String name();
    String description();
    JsonNode inputSchema();
    ToolResult execute(ToolContext ctx, JsonNode input);

    default boolean isDangerous() {
        return getClass().isAnnotationPresent(DangerousOperation.class);
    }

    default ToolDefinition toolDefinition() {
        return new ToolDefinition(name(), description(), inputSchema(), isDangerous());
    }
}
