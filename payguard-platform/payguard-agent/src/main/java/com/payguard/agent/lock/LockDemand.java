package com.payguard.agent.lock;

import java.util.Objects;

/**
 * A request for a lock of a given type from one source (tamper escalation or payment state).
 */
public record LockDemand(
        LockType type,
        LockReason reason,
        String message
) {
    public LockDemand {
        Objects.requireNonNull(type, "Lock type cannot be null");
        Objects.requireNonNull(reason, "Lock reason cannot be null");
        message = message != null ? message : "";
    }

    /**
     * Same type and reason; the message is presentation only.
     */
    public boolean sameAs(LockDemand other) {
        return other != null && type == other.type && reason == other.reason;
    }
}
