package com.loopclaw.agent;

import com.fasterxml.jackson.databind.JsonNode;

public sealed interface ContentBlock permits ContentBlock.Text, ContentBlock.ToolUse {

    record Text(String text) implements ContentBlock {}

    record ToolUse(String id, String name, JsonNode input) implements ContentBlock {
        public boolean isComplete() {
            return id != null && !id.isBlank() && name != null && !name.isBlank();
        }
    }
}
