package com.payguard.agent.support;

import com.payguard.agent.kernel.event.AgentEvent;
import com.payguard.agent.kernel.event.AgentEventType;
import com.payguard.agent.kernel.event.EventBus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Collects every event on a bus. Delivery is asynchronous, so lookups wait briefly.
 */
public class EventRecorder {

    private static final long WAIT_MILLIS = 2_000;

    private final List<AgentEvent> events = Collections.synchronizedList(new ArrayList<>());

    public EventRecorder(EventBus eventBus) {
        eventBus.subscribe(AgentEventType.ALL, events::add);
    }

    public Optional<AgentEvent> await(AgentEventType type) {
        long deadline = System.currentTimeMillis() + WAIT_MILLIS;
        while (System.currentTimeMillis() < deadline) {
            Optional<AgentEvent> found = first(type);
            if (found.isPresent()) {
                return found;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
        }
        return first(type);
    }

    public List<AgentEventType> types() {
        synchronized (events) {
            return events.stream().map(AgentEvent::eventType).toList();
        }
    }

    private Optional<AgentEvent> first(AgentEventType type) {
        synchronized (events) {
            return events.stream().filter(e -> e.eventType() == type).findFirst();
        }
    }
}
