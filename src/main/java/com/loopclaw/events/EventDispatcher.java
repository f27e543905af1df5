package com.loopclaw.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events out to listeners. Delivery is serialized: a listener never sees
 * two events at once, even when tool tasks emit from several threads.
 * A failing listener is logged and skipped.
 */
public class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<AgentEventListener> listeners = new CopyOnWriteArrayList<>();

    public EventDispatcher() {}

    public EventDispatcher(AgentEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void addListener(AgentEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(AgentEventListener listener) {
        listeners.remove(listener);
    }

    public synchronized void emit(AgentEvent event) {
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Event listener failed on {}: {}", event.type().value(), e.getMessage());
            }
        }
    }
}
