package com.payguard.agent.removal;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.queue.AlertSeverity;
import com.payguard.agent.store.StateRepository;
import com.payguard.agent.trust.TamperStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Assigns attempt numbers to incidents and deduplicates the two detection paths.
 *
 * <p>Platform notifications are numbered immediately and kept as pending until a poll
 * observes them. A poll whose flags are all covered by pending notifications is the same
 * incident seen twice and gets no new number. A clean poll clears anything pending.</p>
 *
 * <p>Removal attempts carry a second counter of their own. It drives the attempt-based alert
 * severity and escalation level, so earlier poll drift does not inflate a first uninstall attempt.</p>
 *
 * <p>Both counters are persisted, so numbers keep increasing across restarts.
 * Callers serialize access per device.</p>
 */
public class IncidentRecorder {

    private static final Logger log = LoggerFactory.getLogger(IncidentRecorder.class);
    private static final String KEY = "incidents.";

    private final StateRepository repository;
    private final AuditLog auditLog;

    public IncidentRecorder(StateRepository repository, AuditLog auditLog) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
    }

    /**
     * Records an incident reported by a platform notification.
     */
    public IncidentTicket recordNotification(ProtectionEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        IncidentLedger ledger = load(event.deviceId());
        long attemptNumber = ledger.lastAttemptNumber() + 1;
        boolean removal = event.type().removalAttempt();
        long removalAttempts = removal ? ledger.removalAttempts() + 1 : ledger.removalAttempts();

        List<PendingIncident> pending = new ArrayList<>(ledger.unobserved());
        pending.add(new PendingIncident(attemptNumber, event.impliedFlags(), event.occurredAt()));
        save(event.deviceId(), new IncidentLedger(attemptNumber, pending, removalAttempts));

        auditLog.logIncident(event.deviceId(), attemptNumber, IncidentSource.PLATFORM_NOTIFICATION.name(),
                event.impliedFlags());
        log.warn("Protection event {} on {} recorded as attempt #{}", event.type(), event.deviceId(), attemptNumber);

        if (!removal) {
            return new IncidentTicket(attemptNumber, IncidentSource.PLATFORM_NOTIFICATION, false, null, 0);
        }
        return new IncidentTicket(attemptNumber, IncidentSource.PLATFORM_NOTIFICATION, false,
                AlertSeverity.forAttempt(removalAttempts), removalAttempts);
    }

    /**
     * Records the outcome of a poll verification.
     */
    public IncidentTicket observePoll(String deviceId, TamperStatus status) {
        Objects.requireNonNull(status, "Status cannot be null");
        IncidentLedger ledger = load(deviceId);

        if (!status.tampered()) {
            if (!ledger.unobserved().isEmpty()) {
                save(deviceId, new IncidentLedger(ledger.lastAttemptNumber(), List.of(), ledger.removalAttempts()));
            }
            return IncidentTicket.none();
        }

        Set<String> pendingFlags = new HashSet<>();
        long latestPending = 0;
        for (PendingIncident incident : ledger.unobserved()) {
            pendingFlags.addAll(incident.flags());
            latestPending = Math.max(latestPending, incident.attemptNumber());
        }

        if (!ledger.unobserved().isEmpty() && pendingFlags.containsAll(status.flags())) {
            save(deviceId, new IncidentLedger(ledger.lastAttemptNumber(), List.of(), ledger.removalAttempts()));
            log.debug("Poll on {} matched pending incident #{}, not recounted", deviceId, latestPending);
            return new IncidentTicket(latestPending, IncidentSource.POLL, true, null, 0);
        }

        long attemptNumber = ledger.lastAttemptNumber() + 1;
        save(deviceId, new IncidentLedger(attemptNumber, List.of(), ledger.removalAttempts()));
        auditLog.logIncident(deviceId, attemptNumber, IncidentSource.POLL.name(), status.flags());
        return new IncidentTicket(attemptNumber, IncidentSource.POLL, false, null, 0);
    }

    public long lastAttemptNumber(String deviceId) {
        return load(deviceId).lastAttemptNumber();
    }

    public long removalAttempts(String deviceId) {
        return load(deviceId).removalAttempts();
    }

    public List<PendingIncident> unobserved(String deviceId) {
        return load(deviceId).unobserved();
    }

    private IncidentLedger load(String deviceId) {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        return repository.read(KEY + deviceId, IncidentLedger.class)
                .orElseGet(() -> new IncidentLedger(0, List.of(), 0));
    }

    private void save(String deviceId, IncidentLedger ledger) {
        repository.write(KEY + deviceId, ledger);
    }

    // ==================== Inner Types ====================

    public record PendingIncident(
            long attemptNumber,
            List<String> flags,
            Instant occurredAt
    ) {
        public PendingIncident {
            flags = flags != null ? List.copyOf(flags) : List.of();
        }
    }

    public record IncidentLedger(
            long lastAttemptNumber,
            List<PendingIncident> unobserved,
            long removalAttempts
    ) {
        public IncidentLedger {
            unobserved = unobserved != null ? List.copyOf(unobserved) : List.of();
        }
    }
}
