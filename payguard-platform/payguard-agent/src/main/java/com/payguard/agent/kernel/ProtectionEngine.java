package com.payguard.agent.kernel;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.baseline.BaselineOrigin;
import com.payguard.agent.baseline.BaselineReference;
import com.payguard.agent.baseline.BaselineStore;
import com.payguard.agent.command.CommandExecutor;
import com.payguard.agent.error.PersistenceException;
import com.payguard.agent.error.Result;
import com.payguard.agent.escalation.EscalationOutcome;
import com.payguard.agent.escalation.EscalationState;
import com.payguard.agent.escalation.EscalationStateMachine;
import com.payguard.agent.kernel.event.AgentEvent;
import com.payguard.agent.kernel.event.AgentEventType;
import com.payguard.agent.kernel.event.EventBus;
import com.payguard.agent.lock.LockEnforcementManager;
import com.payguard.agent.lock.LockType;
import com.payguard.agent.lock.UnlockResult;
import com.payguard.agent.protection.ProtectionSelfCheck;
import com.payguard.agent.protection.ProtectionState;
import com.payguard.agent.queue.OfflineAlertQueue;
import com.payguard.agent.removal.IncidentRecorder;
import com.payguard.agent.removal.IncidentTicket;
import com.payguard.agent.removal.ProtectionEvent;
import com.payguard.agent.snapshot.DeviceSnapshot;
import com.payguard.agent.snapshot.SnapshotCollector;
import com.payguard.agent.sync.BackendResponse;
import com.payguard.agent.sync.HeartbeatClient;
import com.payguard.agent.sync.SyncPayload;
import com.payguard.agent.sync.SyncStatus;
import com.payguard.agent.trust.ComparisonEngine;
import com.payguard.agent.trust.SeverityClassifier;
import com.payguard.agent.trust.TamperStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Drives verification cycles and reacts to platform notifications, payment changes and
 * connectivity changes.
 *
 * <p>A cycle captures and compares outside the device mutex, then records the incident,
 * transitions escalation and applies the lock under it. The heartbeat runs outside the
 * mutex; its response (baseline commit, clearance, PIN, command) is applied under it
 * again. Queued alerts are drained after a successful heartbeat.</p>
 *
 * <p>This is the error boundary: nothing a cycle throws escapes. A failed cycle is reported
 * as degraded protection and retried at the next poll.</p>
 */
public class ProtectionEngine {

    private static final Logger log = LoggerFactory.getLogger(ProtectionEngine.class);

    private final SnapshotCollector collector;
    private final BaselineStore baselineStore;
    private final ComparisonEngine comparisonEngine;
    private final SeverityClassifier classifier;
    private final IncidentRecorder incidentRecorder;
    private final EscalationStateMachine escalation;
    private final LockEnforcementManager lockManager;
    private final OfflineAlertQueue alertQueue;
    private final HeartbeatClient heartbeatClient;
    private final CommandExecutor commandExecutor;
    private final ProtectionSelfCheck selfCheck;
    private final DeviceMutex mutex;
    private final EventBus eventBus;
    private final AuditLog auditLog;
    private final Clock clock;
    private final Map<String, ProtectionState> lastProtection = new ConcurrentHashMap<>();

    public ProtectionEngine(
            SnapshotCollector collector,
            BaselineStore baselineStore,
            ComparisonEngine comparisonEngine,
            SeverityClassifier classifier,
            IncidentRecorder incidentRecorder,
            EscalationStateMachine escalation,
            LockEnforcementManager lockManager,
            OfflineAlertQueue alertQueue,
            HeartbeatClient heartbeatClient,
            CommandExecutor commandExecutor,
            ProtectionSelfCheck selfCheck,
            DeviceMutex mutex,
            EventBus eventBus,
            AuditLog auditLog,
            Clock clock) {
        this.collector = Objects.requireNonNull(collector, "Collector cannot be null");
        this.baselineStore = Objects.requireNonNull(baselineStore, "Baseline store cannot be null");
        this.comparisonEngine = Objects.requireNonNull(comparisonEngine, "Comparison engine cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "Classifier cannot be null");
        this.incidentRecorder = Objects.requireNonNull(incidentRecorder, "Incident recorder cannot be null");
        this.escalation = Objects.requireNonNull(escalation, "Escalation cannot be null");
        this.lockManager = Objects.requireNonNull(lockManager, "Lock manager cannot be null");
        this.alertQueue = Objects.requireNonNull(alertQueue, "Alert queue cannot be null");
        this.heartbeatClient = Objects.requireNonNull(heartbeatClient, "Heartbeat client cannot be null");
        this.commandExecutor = Objects.requireNonNull(commandExecutor, "Command executor cannot be null");
        this.selfCheck = Objects.requireNonNull(selfCheck, "Self check cannot be null");
        this.mutex = Objects.requireNonNull(mutex, "Mutex cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    // ==================== Verification Cycle ====================

    /**
     * Runs one full verification cycle for the device.
     */
    public CycleReport runCycle(String deviceId) {
        Instant startedAt = clock.instant();
        List<String> degraded = new ArrayList<>();

        try {
            DeviceSnapshot snapshot = collector.capture();
            if (!snapshot.complete()) {
                auditLog.record(AuditLog.EventType.COLLECTION_DEGRADED, AuditLog.Severity.LOW,
                        "Partial snapshot",
                        Map.of("deviceId", deviceId, "unavailable", String.join(",", snapshot.unavailableFields())));
            }

            TamperStatus status = verify(deviceId, snapshot);
            auditLog.logVerification(deviceId, status.severity().name(), status.flags(), status.inconclusive());
            if (status.inconclusive()) {
                log.warn("No baseline for {}, verification inconclusive", deviceId);
            }

            LocalOutcome local = mutex.withLock(deviceId, () -> applyVerification(deviceId, status));

            SyncPayload payload = new SyncPayload(deviceId, clock.instant(), snapshot, status.severity(),
                    status.flags(), local.lockedAfter(), syncStatus(deviceId));
            Result<BackendResponse> sync = heartbeatClient.sync(payload);

            int delivered = 0;
            if (sync.isOk()) {
                mutex.run(deviceId, () -> applyResponse(deviceId, sync.value()));
                delivered = alertQueue.drain(deviceId);
                if (delivered > 0) {
                    eventBus.emit(new AgentEvent(AgentEventType.ALERTS_DELIVERED, deviceId, clock.instant(),
                            delivered + " alert(s) delivered"));
                }
            } else {
                log.info("Heartbeat for {} failed, alerts stay queued: {}", deviceId, sync.message());
                auditLog.record(AuditLog.EventType.NETWORK_FAILURE, AuditLog.Severity.LOW, "Heartbeat failed",
                        Map.of("deviceId", deviceId, "message", sync.message()));
            }

            ProtectionState protection = selfCheck.check(deviceId, degraded);
            lastProtection.put(deviceId, protection);

            boolean lockedNow = lockManager.isLocked(deviceId);
            CycleReport report = new CycleReport(deviceId, status, local.outcome(), local.ticket().duplicate(),
                    lockedNow, sync.isOk(), delivered, protection, startedAt, clock.instant(), null);

            if (local.ticket().recorded()) {
                eventBus.emit(new AgentEvent(AgentEventType.INCIDENT_DETECTED, deviceId, status.timestamp(),
                        "Tamper severity " + status.severity(),
                        Map.of("attemptNumber", local.ticket().attemptNumber(), "flags", status.flags())));
            }
            if (lockedNow != local.lockedBefore()) {
                emitLockChange(deviceId, lockedNow);
            }
            eventBus.emit(new AgentEvent(AgentEventType.CYCLE_COMPLETED, deviceId, report.finishedAt(),
                    "Severity " + status.severity()));
            return report;

        } catch (RuntimeException e) {
            String reason = (e instanceof PersistenceException ? "persistence: " : "cycle: ") + e.getMessage();
            log.error("Verification cycle for {} failed", deviceId, e);
            degraded.add(reason);
            ProtectionState protection = degradedProtection(deviceId, degraded);
            eventBus.emit(new AgentEvent(AgentEventType.CYCLE_DEGRADED, deviceId, clock.instant(), reason));
            return CycleReport.failed(deviceId, protection, startedAt, clock.instant(), reason);
        }
    }

    // ==================== Asynchronous Triggers ====================

    /**
     * Handles a platform protection notification as an incident of its own.
     *
     * @return the escalation outcome, empty when handling failed
     */
    public Optional<EscalationOutcome> onProtectionEvent(ProtectionEvent event) {
        Objects.requireNonNull(event, "Event cannot be null");
        String deviceId = event.deviceId();
        try {
            EscalationOutcome outcome = mutex.withLock(deviceId, () -> {
                boolean lockedBefore = lockManager.isLocked(deviceId);
                IncidentTicket ticket = incidentRecorder.recordNotification(event);
                TamperStatus status = TamperStatus.of(event.severity(), event.impliedFlags(), event.occurredAt());
                EscalationOutcome result = escalation.transition(deviceId, status, ticket);
                lockManager.enforce(deviceId);
                eventBus.emit(new AgentEvent(AgentEventType.INCIDENT_DETECTED, deviceId, event.occurredAt(),
                        event.type().name(), Map.of("attemptNumber", ticket.attemptNumber())));
                boolean lockedNow = lockManager.isLocked(deviceId);
                if (lockedNow != lockedBefore) {
                    emitLockChange(deviceId, lockedNow);
                }
                return result;
            });
            alertQueue.drain(deviceId);
            return Optional.of(outcome);
        } catch (RuntimeException e) {
            log.error("Handling {} for {} failed", event.type(), deviceId, e);
            degradedProtection(deviceId, List.of("notification: " + e.getMessage()));
            return Optional.empty();
        }
    }

    /**
     * Re-evaluates the lock after the loan standing changed.
     *
     * @return whether the device is locked afterwards
     */
    public boolean onLoanStatusChanged(String deviceId) {
        return mutex.withLock(deviceId, () -> {
            boolean lockedBefore = lockManager.isLocked(deviceId);
            lockManager.enforce(deviceId);
            boolean lockedNow = lockManager.isLocked(deviceId);
            if (lockedNow != lockedBefore) {
                emitLockChange(deviceId, lockedNow);
            }
            return lockedNow;
        });
    }

    /**
     * @return number of alerts delivered
     */
    public int onConnectivityChanged(String deviceId, boolean online) {
        if (!online) {
            eventBus.emit(new AgentEvent(AgentEventType.NETWORK_UNAVAILABLE, deviceId, clock.instant()));
            return 0;
        }
        eventBus.emit(new AgentEvent(AgentEventType.NETWORK_AVAILABLE, deviceId, clock.instant()));
        int delivered = alertQueue.drain(deviceId);
        if (delivered > 0) {
            eventBus.emit(new AgentEvent(AgentEventType.ALERTS_DELIVERED, deviceId, clock.instant(),
                    delivered + " alert(s) delivered"));
        }
        return delivered;
    }

    // ==================== Operator Actions ====================

    /**
     * Captures the current state and stores it as the enrollment baseline.
     */
    public BaselineReference enroll(String deviceId) {
        DeviceSnapshot snapshot = collector.capture();
        if (!snapshot.complete()) {
            log.warn("Enrolling {} with a partial snapshot, unavailable: {}", deviceId, snapshot.unavailableFields());
        }
        return baselineStore.enroll(deviceId, snapshot);
    }

    public Optional<BaselineReference> recoverBaseline(String deviceId) {
        return baselineStore.recover(deviceId);
    }

    public EscalationState resetEscalation(String deviceId, String reason) {
        return mutex.withLock(deviceId, () -> escalation.reset(deviceId, reason));
    }

    public UnlockResult unlockWithPin(String deviceId, String pin) {
        return mutex.withLock(deviceId, () -> {
            UnlockResult result = lockManager.unlockWithPin(deviceId, pin);
            if (result.success()) {
                emitLockChange(deviceId, lockManager.isLocked(deviceId));
            }
            return result;
        });
    }

    public boolean dismissSoftLock(String deviceId) {
        return mutex.withLock(deviceId, () -> {
            boolean dismissed = lockManager.dismissSoftLock(deviceId);
            if (dismissed) {
                emitLockChange(deviceId, lockManager.isLocked(deviceId));
            }
            return dismissed;
        });
    }

    /**
     * Last known protection state, checking now if no cycle has run yet.
     */
    public ProtectionState protectionState(String deviceId) {
        ProtectionState known = lastProtection.get(deviceId);
        return known != null ? known : degradedProtection(deviceId, List.of());
    }

    // ==================== Private Methods ====================

    private TamperStatus verify(String deviceId, DeviceSnapshot snapshot) {
        return baselineStore.withActive(deviceId, baseline -> baseline
                .map(reference -> classifier.classify(
                        comparisonEngine.compare(snapshot, reference.snapshot()), snapshot.capturedAt()))
                .orElseGet(() -> TamperStatus.inconclusive(snapshot.capturedAt())));
    }

    private LocalOutcome applyVerification(String deviceId, TamperStatus status) {
        boolean lockedBefore = lockManager.isLocked(deviceId);
        IncidentTicket ticket = incidentRecorder.observePoll(deviceId, status);
        EscalationOutcome outcome = null;
        if (!ticket.duplicate()) {
            outcome = escalation.transition(deviceId, status, ticket);
        }
        lockManager.expireSoftLocks(deviceId);
        lockManager.enforce(deviceId);
        return new LocalOutcome(ticket, outcome, lockedBefore, lockManager.isLocked(deviceId));
    }

    private void applyResponse(String deviceId, BackendResponse response) {
        if (response.verifiedSnapshot() != null) {
            baselineStore.commit(deviceId, response.verifiedSnapshot(), BaselineOrigin.BACKEND_CONFIRMED);
        }
        if (response.unlockPin() != null && !response.unlockPin().isBlank()) {
            lockManager.provisionUnlockPin(deviceId, response.unlockPin());
        }
        if (response.clearanceGranted()) {
            escalation.clear(deviceId, "heartbeat clearance");
        }
        BackendResponse.LockStatusView lockStatus = response.lockStatus();
        if (lockStatus != null && !lockStatus.locked() && lockManager.isLocked(deviceId)) {
            lockManager.unlockFromBackend(deviceId, "heartbeat");
        } else if (lockStatus != null && lockStatus.locked()) {
            LockType requested = lockStatus.lockType() != null ? lockStatus.lockType() : LockType.HARD;
            if (requested.stricterThan(escalation.current(deviceId).tamperLockDemand())) {
                escalation.demandLock(deviceId, requested);
            }
        }
        if (response.command() != null) {
            commandExecutor.execute(deviceId, response.command());
        }
        lockManager.enforce(deviceId);
    }

    private SyncStatus syncStatus(String deviceId) {
        ProtectionState previous = lastProtection.get(deviceId);
        if (previous != null && !previous.degradedReasons().isEmpty()) {
            return SyncStatus.DEGRADED;
        }
        return alertQueue.status(deviceId).pendingCount() > 0 ? SyncStatus.PENDING_ALERTS : SyncStatus.IN_SYNC;
    }

    private ProtectionState degradedProtection(String deviceId, List<String> reasons) {
        ProtectionState state;
        try {
            state = selfCheck.check(deviceId, reasons);
        } catch (RuntimeException e) {
            log.error("Protection self-check for {} failed", deviceId, e);
            List<String> all = new ArrayList<>(reasons);
            all.add("self-check: " + e.getMessage());
            state = new ProtectionState(false, false, false, false, false, all, clock.instant());
        }
        lastProtection.put(deviceId, state);
        return state;
    }

    private void emitLockChange(String deviceId, boolean locked) {
        eventBus.emit(new AgentEvent(AgentEventType.LOCK_STATE_CHANGED, deviceId, clock.instant(),
                locked ? "Device locked" : "Device unlocked", Map.of("locked", locked)));
    }

    private record LocalOutcome(
            IncidentTicket ticket,
            EscalationOutcome outcome,
            boolean lockedBefore,
            boolean lockedAfter
    ) {}
}
