package com.payguard.agent.sync;

public enum SyncStatus {
    /** Nothing waiting for delivery. */
    IN_SYNC,
    /** Alerts are queued from a period without connectivity. */
    PENDING_ALERTS,
    /** The last verification cycle could not complete. */
    DEGRADED
}
