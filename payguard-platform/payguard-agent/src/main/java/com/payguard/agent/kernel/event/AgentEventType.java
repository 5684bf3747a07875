package com.payguard.agent.kernel.event;

/**
 * Types of events emitted by the agent kernel.
 */
public enum AgentEventType {
    // Lifecycle events
    BOOT_STARTED,
    STATE_VERIFIED,
    BASELINE_READY,
    POLLING_STARTED,
    BOOT_COMPLETE,
    BOOT_FAILED,
    SHUTDOWN_STARTED,
    SHUTDOWN_COMPLETE,

    // Verification events
    CYCLE_COMPLETED,
    CYCLE_DEGRADED,
    INCIDENT_DETECTED,
    LOCK_STATE_CHANGED,

    // Connectivity events
    NETWORK_AVAILABLE,
    NETWORK_UNAVAILABLE,
    ALERTS_DELIVERED,

    // Wildcard for subscribing to all events
    ALL
}
