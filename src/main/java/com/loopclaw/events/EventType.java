package com.loopclaw.events;

public enum EventType {
    ITERATION_START("iteration_start"),
    ITERATION_END("iteration_end"),
    AI_RESPONSE("ai_response"),
    TOOL_START("tool_start"),
    TOOL_COMPLETE("tool_complete"),
    TOOL_ERROR("tool_error"),
    TOOL_APPROVAL_NEEDED("tool_approval_needed"),
    TOOL_APPROVED("tool_approved"),
    TOOL_DENIED("tool_denied"),
    AGENT_COMPLETE("agent_complete");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    public String value() { return value; }
}
