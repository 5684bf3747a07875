package com.payguard.agent.kernel.event;

import com.payguard.agent.error.BoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * Internal event bus. Handlers run asynchronously and never block the emitter.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<AgentEventType, CopyOnWriteArrayList<Subscription>> subscriptions;
    private final Map<String, Subscription> subscriptionById;
    private final ExecutorService executor;

    public EventBus() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.subscriptionById = new ConcurrentHashMap<>();
        this.executor = Executors.newCachedThreadPool(BoundedCall.daemonThreads("agent-events"));
    }

    /**
     * Emits an event to all subscribers of its type and to wildcard subscribers.
     */
    public void emit(AgentEvent event) {
        if (event == null) {
            return;
        }
        dispatch(subscriptions.get(event.eventType()), event);
        dispatch(subscriptions.get(AgentEventType.ALL), event);
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @return subscription ID
     */
    public String subscribe(AgentEventType eventType, Consumer<AgentEvent> handler) {
        String subscriptionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(subscriptionId, eventType, handler);

        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(subscriptionId, subscription);

        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription != null) {
            CopyOnWriteArrayList<Subscription> subs = subscriptions.get(subscription.eventType());
            if (subs != null) {
                subs.remove(subscription);
            }
        }
    }

    public void shutdown() {
        executor.shutdown();
    }

    private void dispatch(List<Subscription> subs, AgentEvent event) {
        if (subs == null) {
            return;
        }
        for (Subscription sub : subs) {
            try {
                executor.submit(() -> {
                    try {
                        sub.handler().accept(event);
                    } catch (RuntimeException e) {
                        log.warn("Handler for {} failed: {}", event.eventType(), e.getMessage());
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Event bus stopped, dropping {}", event.eventType());
                return;
            }
        }
    }

    private record Subscription(
            String id,
            AgentEventType eventType,
            Consumer<AgentEvent> handler
    ) {}
}
