package com.payguard.agent.kernel;

import com.payguard.agent.escalation.EscalationOutcome;
import com.payguard.agent.protection.ProtectionState;
import com.payguard.agent.trust.TamperStatus;

import java.time.Instant;

/**
 * Summary of one verification cycle.
 *
 * @param escalation null when the cycle failed or the poll repeated an already handled incident
 * @param deduplicated the poll observed an incident already recorded from a platform notification
 * @param failure why the cycle stopped early, null on success
 */
public record CycleReport(
        String deviceId,
        TamperStatus status,
        EscalationOutcome escalation,
        boolean deduplicated,
        boolean locked,
        boolean synced,
        int alertsDelivered,
        ProtectionState protection,
        Instant startedAt,
        Instant finishedAt,
        String failure
) {
    public boolean succeeded() {
        return failure == null;
    }

    static CycleReport failed(String deviceId, ProtectionState protection, Instant startedAt,
                              Instant finishedAt, String failure) {
        return new CycleReport(deviceId, null, null, false, false, false, 0, protection,
                startedAt, finishedAt, failure);
    }
}
