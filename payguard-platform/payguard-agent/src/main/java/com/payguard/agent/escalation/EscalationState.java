package com.payguard.agent.escalation;

import com.payguard.agent.lock.LockType;
import com.payguard.agent.trust.TamperSeverity;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted escalation state of one device.
 *
 * @param consecutiveIncidents incidents since the last clean verification
 * @param tamperLockDemand lock demanded by tamper escalation; sticky until backend clearance
 */
public record EscalationState(
        String deviceId,
        int consecutiveIncidents,
        TamperSeverity lastSeverity,
        ResponseAction lastActionTaken,
        Instant lastUpdated,
        LockType tamperLockDemand
) {
    public EscalationState {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(lastSeverity, "Last severity cannot be null");
        Objects.requireNonNull(lastActionTaken, "Last action cannot be null");
        if (consecutiveIncidents < 0) {
            throw new IllegalArgumentException("consecutiveIncidents cannot be negative");
        }
    }

    public static EscalationState initial(String deviceId) {
        return new EscalationState(deviceId, 0, TamperSeverity.NONE, ResponseAction.NONE, null, null);
    }
}
