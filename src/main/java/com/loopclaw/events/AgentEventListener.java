package com.loopclaw.events;

@FunctionalInterface
public interface AgentEventListener {
    void onEvent(AgentEvent event);
}
