package com.loopclaw.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingEventListener implements AgentEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(AgentEvent event) {
        switch (event.type()) {
            case TOOL_ERROR, TOOL_DENIED -> log.warn("[{}] #{} {} {}", event.type().value(),
                    event.iteration(), event.toolName(), event.message());
            case TOOL_START, TOOL_COMPLETE, TOOL_APPROVAL_NEEDED, TOOL_APPROVED ->
                    log.info("[{}] #{} {} {}", event.type().value(), event.iteration(),
                            event.toolName(), event.message());
            default -> log.debug("[{}] #{} {} {}", event.type().value(), event.iteration(),
                    event.message(), event.data());
        }
    }
}
