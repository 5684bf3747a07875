package com.payguard.agent.kernel.event;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted by the agent for components that observe it (UI, telemetry, tests).
 */
public record AgentEvent(
        AgentEventType eventType,
        String deviceId,
        Instant timestamp,
        String message,
        Map<String, Object> metadata
) {
    public AgentEvent {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public AgentEvent(AgentEventType eventType, String deviceId, Instant timestamp) {
        this(eventType, deviceId, timestamp, null, Map.of());
    }

    public AgentEvent(AgentEventType eventType, String deviceId, Instant timestamp, String message) {
        this(eventType, deviceId, timestamp, message, Map.of());
    }
}
