package com.payguard.agent.queue;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An alert waiting for (or past) delivery to the backend.
 *
 * @param escalationLevel 0 to 3, derived from how many incidents have accumulated
 * @param deliveredAt null while pending
 */
public record QueuedAlert(
        String alertId,
        String deviceId,
        long attemptNumber,
        AlertSeverity severity,
        int escalationLevel,
        boolean deviceLocked,
        List<String> flags,
        Instant occurredAt,
        Instant queuedAt,
        Instant deliveredAt,
        int deliveryAttempts,
        String lastError
) {
    public QueuedAlert {
        Objects.requireNonNull(alertId, "Alert ID cannot be null");
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(severity, "Severity cannot be null");
        if (escalationLevel < 0 || escalationLevel > 3) {
            throw new IllegalArgumentException("Escalation level must be 0..3");
        }
        flags = flags != null ? List.copyOf(flags) : List.of();
    }

    /**
     * Escalation level for an incident count: below 2 is 0, then 1, 2, and 3 from four on.
     */
    public static int escalationLevelFor(long incidents) {
        if (incidents < 2) {
            return 0;
        }
        if (incidents < 3) {
            return 1;
        }
        if (incidents < 4) {
            return 2;
        }
        return 3;
    }

    QueuedAlert failedDelivery(String error) {
        return new QueuedAlert(alertId, deviceId, attemptNumber, severity, escalationLevel, deviceLocked,
                flags, occurredAt, queuedAt, null, deliveryAttempts + 1, error);
    }

    QueuedAlert delivered(Instant at) {
        return new QueuedAlert(alertId, deviceId, attemptNumber, severity, escalationLevel, deviceLocked,
                flags, occurredAt, queuedAt, at, deliveryAttempts + 1, null);
    }
}
