package com.loopclaw.agent;

import com.loopclaw.providers.ChatResponse;
import com.loopclaw.tools.ToolCall;
import com.loopclaw.tools.ToolResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps the backend's wire shape away from {@link AgentLoop}: reads completions
 * into {@link ContentBlock}s and writes the turns appended to the conversation.
 */
public interface ResponseParser {

    List<ContentBlock> blocks(ChatResponse response);

    Map<String, Object> assistantTurn(ChatResponse response);

    Map<String, Object> toolResultTurn(ToolResult result);

    default boolean hasToolCalls(ChatResponse response) {
        return blocks(response).stream().anyMatch(b -> b instanceof ContentBlock.ToolUse);
    }

    default List<ToolCall> parseResponse(ChatResponse response) {
        var calls = new ArrayList<ToolCall>();
        for (var block : blocks(response)) {
            if (block instanceof ContentBlock.ToolUse use && use.isComplete()) {
                calls.add(new ToolCall(use.id(), use.name(), use.input()));
            }
        }
        return calls;
    }

    default String extractTextContent(ChatResponse response) {
        var parts = new ArrayList<String>();
        for (var block : blocks(response)) {
            if (block instanceof ContentBlock.Text text && text.text() != null && !text.text().isEmpty()) {
                parts.add(text.text());
            }
        }
        return String.join("\n", parts);
    }
}
