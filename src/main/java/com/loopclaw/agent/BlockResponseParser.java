package com.loopclaw.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loopclaw.providers.ChatResponse;
import com.loopclaw.tools.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BlockResponseParser implements ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(BlockResponseParser.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override
    public List<ContentBlock> blocks(ChatResponse response) {
        var content = response.content();
        if (content.isTextual()) {
            return List.of(new ContentBlock.Text(content.asText()));
        }
        if (!content.isArray()) {
            if (!content.isNull() && !content.isMissingNode()) {
                log.warn("Unexpected content type: {}", content.getNodeType());
            }
            return List.of();
        }
        var blocks = new ArrayList<ContentBlock>();
        for (var node : content) {
            if (!node.isObject()) continue;
            switch (node.path("type").asText("")) {
                case "text" -> blocks.add(new ContentBlock.Text(node.path("text").asText("")));
                case "tool_use" -> blocks.add(toolUse(node));
                default -> { }
            }
        }
        return blocks;
    }

    @Override
    public Map<String, Object> assistantTurn(ChatResponse response) {
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", "assistant");
        var content = response.content();
        msg.put("content", content.isTextual() ? content.asText()
                : content.isArray() ? MAPPER.convertValue(content, List.class) : "");
        return msg;
    }

    @Override
    public Map<String, Object> toolResultTurn(ToolResult result) {
        var block = new LinkedHashMap<String, Object>();
        block.put("type", "tool_result");
        block.put("tool_use_id", result.toolCallId());
        block.put("content", result.content());
        block.put("is_error", result.isError());
        var msg = new LinkedHashMap<String, Object>();
        msg.put("role", "user");
        msg.put("content", List.of(block));
        return msg;
    }

    private ContentBlock.ToolUse toolUse(JsonNode node) {
        var use = new ContentBlock.ToolUse(textOrNull(node, "id"), textOrNull(node, "name"), input(node.get("input")));
        if (!use.isComplete()) {
            log.warn("Invalid tool use block: {}", node);
        }
        return use;
    }

    private static JsonNode input(JsonNode raw) {
        if (raw == null || raw.isNull()) {
            return MAPPER.createObjectNode();
        }
        if (raw.isObject()) {
            return raw;
        }
        if (raw.isTextual()) {
            try {
                var parsed = MAPPER.readTree(raw.asText());
                if (parsed != null && parsed.isObject()) return parsed;
            } catch (JsonProcessingException e) {
                log.warn("Failed to parse tool input as JSON: {}", raw.asText());
            }
        }
        return MAPPER.createObjectNode().set("raw_input", raw);
    }

    private static String textOrNull(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
