package com.payguard.agent.removal;

import com.payguard.agent.queue.AlertSeverity;

/**
 * Numbering and dedup verdict for one detected incident.
 *
 * @param attemptNumber persisted, strictly increasing per device; 0 when nothing was recorded
 * @param duplicate the poll observed a condition already handled from a notification
 * @param minimumAlertSeverity floor for the alert severity, null when the source sets none
 * @param removalAttempt removal attempts counted so far; 0 when the incident is not a removal attempt
 */
public record IncidentTicket(
        long attemptNumber,
        IncidentSource source,
        boolean duplicate,
        AlertSeverity minimumAlertSeverity,
        long removalAttempt
) {
    public static IncidentTicket none() {
        return new IncidentTicket(0, IncidentSource.POLL, false, null, 0);
    }

    public boolean removal() {
        return removalAttempt > 0;
    }

    public boolean recorded() {
        return attemptNumber > 0 && !duplicate;
    }
}
