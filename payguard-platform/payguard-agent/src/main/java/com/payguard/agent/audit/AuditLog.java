package com.payguard.agent.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payguard.agent.store.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Hash-chained, append-only audit log of every verification, state transition,
 * response action, lock change and incident.
 *
 * Each entry carries the hash of its predecessor, so editing or dropping a retained
 * entry is detectable through {@link #verifyIntegrity()}. Entries are forwarded to an
 * {@link AuditSink}; a failing sink is logged and never blocks the caller.
 */
public class AuditLog {

    private static final Logger log = LoggerFactory.getLogger(AuditLog.class);

    static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";
    private static final int DEFAULT_MAX_RETAINED = 1000;

    private final List<AuditEntry> entries = new ArrayList<>();
    private final String agentId;
    private final AuditSink sink;
    private final Clock clock;
    private final int maxRetained;
    private final ObjectMapper mapper = StateRepository.createObjectMapper();
    private long nextSequence;
    private String lastHash;

    public AuditLog(String agentId, AuditSink sink, Clock clock) {
        this(agentId, sink, clock, DEFAULT_MAX_RETAINED);
    }

    public AuditLog(String agentId, AuditSink sink, Clock clock, int maxRetained) {
        this.agentId = Objects.requireNonNull(agentId, "Agent ID cannot be null");
        this.sink = Objects.requireNonNull(sink, "Sink cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (maxRetained < 1) {
            throw new IllegalArgumentException("maxRetained must be positive");
        }
        this.maxRetained = maxRetained;
        this.lastHash = GENESIS_HASH;
    }

    /**
     * Appends an event to the chain and forwards it to the sink.
     */
    public AuditEntry append(AuditEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");

        AuditEntry entry;
        synchronized (this) {
            String previousHash = lastHash;
            long sequenceNumber = nextSequence++;
            Instant timestamp = clock.instant();
            String entryHash = computeEntryHash(sequenceNumber, previousHash, event, timestamp);

            entry = new AuditEntry(
                    UUID.randomUUID().toString(),
                    sequenceNumber,
                    event,
                    timestamp,
                    previousHash,
                    entryHash,
                    agentId
            );

            entries.add(entry);
            lastHash = entryHash;
            while (entries.size() > maxRetained) {
                entries.remove(0);
            }
        }

        try {
            sink.write(entry);
        } catch (RuntimeException e) {
            log.warn("Audit sink rejected entry #{} ({}): {}", entry.sequenceNumber(), event.type(), e.getMessage());
        }
        return entry;
    }

    public AuditEntry record(EventType type, Severity severity, String description, Map<String, String> details) {
        return append(new AuditEvent(type, severity, description, details));
    }

    /**
     * Logs the outcome of a verification cycle.
     */
    public AuditEntry logVerification(String deviceId, String tamperSeverity, List<String> flags, boolean inconclusive) {
        return append(new AuditEvent(
                EventType.VERIFICATION,
                inconclusive ? Severity.LOW : Severity.INFO,
                inconclusive ? "Verification inconclusive, no baseline" : "Device verified",
                Map.of(
                        "deviceId", deviceId,
                        "severity", tamperSeverity,
                        "flags", String.join(",", flags),
                        "inconclusive", String.valueOf(inconclusive)
                )
        ));
    }

    public AuditEntry logTransition(String deviceId, int previousCount, int currentCount,
                                    String severity, String action) {
        return append(new AuditEvent(
                EventType.ESCALATION_TRANSITION,
                "NONE".equals(severity) ? Severity.INFO : Severity.MEDIUM,
                "Escalation state updated",
                Map.of(
                        "deviceId", deviceId,
                        "from", String.valueOf(previousCount),
                        "to", String.valueOf(currentCount),
                        "severity", severity,
                        "action", action
                )
        ));
    }

    public AuditEntry logResponseAction(String deviceId, String step, boolean success, String detail) {
        return append(new AuditEvent(
                EventType.RESPONSE_ACTION,
                success ? Severity.MEDIUM : Severity.HIGH,
                success ? "Response action completed" : "Response action failed",
                Map.of(
                        "deviceId", deviceId,
                        "step", step,
                        "success", String.valueOf(success),
                        "detail", detail != null ? detail : ""
                )
        ));
    }

    public AuditEntry logLockApplied(String deviceId, String lockId, String lockType, String reason, boolean enforced) {
        return append(new AuditEvent(
                EventType.LOCK_APPLIED,
                Severity.HIGH,
                "Device lock applied",
                Map.of(
                        "deviceId", deviceId,
                        "lockId", lockId,
                        "lockType", lockType,
                        "reason", reason,
                        "enforced", String.valueOf(enforced)
                )
        ));
    }

    public AuditEntry logLockReleased(String deviceId, String lockId, String lockType, String releasedBy) {
        return append(new AuditEvent(
                EventType.LOCK_RELEASED,
                Severity.MEDIUM,
                "Device lock released",
                Map.of(
                        "deviceId", deviceId,
                        "lockId", lockId,
                        "lockType", lockType,
                        "releasedBy", releasedBy
                )
        ));
    }

    public AuditEntry logUnlockAttempt(String deviceId, String lockId, boolean success, int remainingAttempts) {
        return append(new AuditEvent(
                EventType.UNLOCK_ATTEMPT,
                success ? Severity.MEDIUM : Severity.HIGH,
                success ? "Offline PIN accepted" : "Offline PIN rejected",
                Map.of(
                        "deviceId", deviceId,
                        "lockId", lockId,
                        "success", String.valueOf(success),
                        "remainingAttempts", String.valueOf(remainingAttempts)
                )
        ));
    }

    public AuditEntry logIncident(String deviceId, long attemptNumber, String source, List<String> flags) {
        return append(new AuditEvent(
                EventType.INCIDENT_RECORDED,
                Severity.HIGH,
                "Tamper incident recorded",
                Map.of(
                        "deviceId", deviceId,
                        "attemptNumber", String.valueOf(attemptNumber),
                        "source", source,
                        "flags", String.join(",", flags)
                )
        ));
    }

    public AuditEntry logPrivilegeFailure(String action, String message) {
        return append(new AuditEvent(
                EventType.PRIVILEGE_FAILURE,
                Severity.HIGH,
                "Privileged action failed",
                Map.of(
                        "action", action,
                        "message", message != null ? message : ""
                )
        ));
    }

    public List<AuditEntry> getEntries() {
        synchronized (this) {
            return new ArrayList<>(entries);
        }
    }

    public List<AuditEntry> getEntries(EventType type) {
        return getEntries().stream()
                .filter(e -> e.event().type() == type)
                .toList();
    }

    public List<AuditEntry> getEntries(Instant from, Instant to) {
        return getEntries().stream()
                .filter(e -> !e.timestamp().isBefore(from) && !e.timestamp().isAfter(to))
                .toList();
    }

    public List<AuditEntry> getLatestEntries(int count) {
        List<AuditEntry> snapshot = getEntries();
        int size = snapshot.size();
        return new ArrayList<>(snapshot.subList(Math.max(0, size - count), size));
    }

    /**
     * Verifies the retained part of the chain.
     * The first retained entry anchors the check when older entries have rolled off.
     */
    public VerificationResult verifyIntegrity() {
        List<AuditEntry> snapshot = getEntries();
        if (snapshot.isEmpty()) {
            return new VerificationResult(true, List.of(), 0);
        }

        List<String> errors = new ArrayList<>();
        AuditEntry first = snapshot.get(0);
        String expectedPrevHash = first.sequenceNumber() == 0 ? GENESIS_HASH : first.previousHash();
        long expectedSequence = first.sequenceNumber();

        for (int i = 0; i < snapshot.size(); i++) {
            AuditEntry entry = snapshot.get(i);

            if (entry.sequenceNumber() != expectedSequence) {
                errors.add("Sequence number mismatch at index " + i);
            }
            if (!entry.previousHash().equals(expectedPrevHash)) {
                errors.add("Previous hash mismatch at index " + i);
            }
            String computedHash = computeEntryHash(
                    entry.sequenceNumber(),
                    entry.previousHash(),
                    entry.event(),
                    entry.timestamp()
            );
            if (!entry.entryHash().equals(computedHash)) {
                errors.add("Entry hash mismatch at index " + i + " - possible tampering");
            }

            expectedPrevHash = entry.entryHash();
            expectedSequence = entry.sequenceNumber() + 1;
        }

        return new VerificationResult(errors.isEmpty(), errors, snapshot.size());
    }

    /**
     * Exports the retained entries as a JSON document.
     */
    public String export() {
        List<AuditEntry> snapshot = getEntries();
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("agentId", agentId);
        document.put("exportedAt", clock.instant());
        document.put("entryCount", snapshot.size());
        document.put("entries", snapshot);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Audit export failed", e);
        }
    }

    /**
     * Plain language description of an entry, for support staff reviewing a device.
     */
    public String describe(AuditEntry entry) {
        AuditEvent event = entry.event();
        Map<String, String> details = event.details();

        return switch (event.type()) {
            case VERIFICATION -> "true".equals(details.get("inconclusive"))
                    ? "Verification could not compare against a baseline"
                    : String.format("Verification finished with severity %s", details.get("severity"));
            case ESCALATION_TRANSITION -> String.format("Consecutive incidents went from %s to %s (%s)",
                    details.get("from"), details.get("to"), details.get("action"));
            case RESPONSE_ACTION -> String.format("Response step %s %s",
                    details.get("step"), "true".equals(details.get("success")) ? "completed" : "failed");
            case LOCK_APPLIED -> String.format("%s lock applied for %s",
                    details.get("lockType"), details.get("reason"));
            case LOCK_RELEASED -> String.format("%s lock released by %s",
                    details.get("lockType"), details.get("releasedBy"));
            case UNLOCK_ATTEMPT -> String.format("Offline unlock %s, %s attempts left",
                    "true".equals(details.get("success")) ? "succeeded" : "failed",
                    details.get("remainingAttempts"));
            case INCIDENT_RECORDED -> String.format("Tamper incident #%s from %s",
                    details.get("attemptNumber"), details.get("source"));
            case PRIVILEGE_FAILURE -> String.format("Could not perform %s: %s",
                    details.get("action"), details.get("message"));
            default -> event.description();
        };
    }

    public int size() {
        synchronized (this) {
            return entries.size();
        }
    }

    public String getLastHash() {
        synchronized (this) {
            return lastHash;
        }
    }

    // ==================== Private Methods ====================

    private String computeEntryHash(long sequenceNumber, String previousHash,
                                    AuditEvent event, Instant timestamp) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String data = sequenceNumber + "|" + previousHash + "|" +
                    event.type() + "|" + event.severity() + "|" + event.description() + "|" +
                    event.details() + "|" + timestamp.toEpochMilli();
            return HexFormat.of().formatHex(digest.digest(data.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // ==================== Inner Types ====================

    public enum EventType {
        VERIFICATION,
        ESCALATION_TRANSITION,
        ESCALATION_RESET,
        RESPONSE_ACTION,
        LOCK_APPLIED,
        LOCK_RELEASED,
        UNLOCK_ATTEMPT,
        INCIDENT_RECORDED,
        ALERT_QUEUED,
        ALERT_PRUNED,
        ALERT_DELIVERED,
        COMMAND_EXECUTED,
        BASELINE_COMMITTED,
        COLLECTION_DEGRADED,
        NETWORK_FAILURE,
        PRIVILEGE_FAILURE,
        PROTECTION_CHECK
    }

    public enum Severity {
        INFO,
        LOW,
        MEDIUM,
        HIGH,
        CRITICAL
    }

    /**
     * An audit event. Details are kept in key order so the entry hash is stable.
     */
    public record AuditEvent(
            EventType type,
            Severity severity,
            String description,
            Map<String, String> details
    ) {
        public AuditEvent {
            Objects.requireNonNull(type, "Type cannot be null");
            Objects.requireNonNull(severity, "Severity cannot be null");
            Objects.requireNonNull(description, "Description cannot be null");
            details = details != null
                    ? Collections.unmodifiableMap(new TreeMap<>(details))
                    : Map.of();
        }
    }

    public record AuditEntry(
            String id,
            long sequenceNumber,
            AuditEvent event,
            Instant timestamp,
            String previousHash,
            String entryHash,
            String agentId
    ) {
        public AuditEntry {
            Objects.requireNonNull(id, "ID cannot be null");
            Objects.requireNonNull(event, "Event cannot be null");
            Objects.requireNonNull(timestamp, "Timestamp cannot be null");
            Objects.requireNonNull(previousHash, "Previous hash cannot be null");
            Objects.requireNonNull(entryHash, "Entry hash cannot be null");
            Objects.requireNonNull(agentId, "Agent ID cannot be null");
        }
    }

    public record VerificationResult(
            boolean valid,
            List<String> errors,
            int entriesVerified
    ) {
        public VerificationResult {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }
}
