package com.payguard.agent.escalation;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import com.payguard.agent.lock.LockEnforcementManager;
import com.payguard.agent.lock.LockReason;
import com.payguard.agent.lock.LockType;
import com.payguard.agent.platform.PrivilegeGateway;
import com.payguard.agent.queue.AlertSeverity;
import com.payguard.agent.queue.OfflineAlertQueue;
import com.payguard.agent.queue.QueuedAlert;
import com.payguard.agent.removal.IncidentTicket;
import com.payguard.agent.trust.TamperSeverity;
import com.payguard.agent.trust.TamperStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Tracks consecutive incidents per device and runs the response for each severity.
 *
 * <ul>
 *   <li>NONE: counter back to 0, normal cadence</li>
 *   <li>LOW: recorded only</li>
 *   <li>MEDIUM: warning alert queued, cadence accelerated</li>
 *   <li>HIGH: HARD lock, camera, USB and developer options disabled, HIGH alert queued</li>
 *   <li>CRITICAL: as HIGH plus sensitive data wipe, CRITICAL alert queued</li>
 * </ul>
 *
 * The new state is persisted before any response step runs. Steps are independent: a
 * failing step is logged and audited and the remaining steps still run. The HARD lock is
 * requested before any feature is disabled. Callers hold the device mutex.
 */
public class EscalationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(EscalationStateMachine.class);

    private final EscalationStateStore store;
    private final LockEnforcementManager lockManager;
    private final PrivilegeGateway privilegeGateway;
    private final OfflineAlertQueue alertQueue;
    private final MonitoringCadence cadence;
    private final AuditLog auditLog;
    private final Clock clock;

    public EscalationStateMachine(
            EscalationStateStore store,
            LockEnforcementManager lockManager,
            PrivilegeGateway privilegeGateway,
            OfflineAlertQueue alertQueue,
            MonitoringCadence cadence,
            AuditLog auditLog,
            Clock clock) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.lockManager = Objects.requireNonNull(lockManager, "Lock manager cannot be null");
        this.privilegeGateway = Objects.requireNonNull(privilegeGateway, "Privilege gateway cannot be null");
        this.alertQueue = Objects.requireNonNull(alertQueue, "Alert queue cannot be null");
        this.cadence = Objects.requireNonNull(cadence, "Cadence cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public EscalationState current(String deviceId) {
        return store.load(deviceId);
    }

    /**
     * Applies one classified verification or incident.
     */
    public EscalationOutcome transition(String deviceId, TamperStatus status, IncidentTicket ticket) {
        Objects.requireNonNull(status, "Status cannot be null");
        IncidentTicket incident = ticket != null ? ticket : IncidentTicket.none();
        TamperSeverity severity = status.severity();

        EscalationState previous = store.load(deviceId);
        int count = severity == TamperSeverity.NONE ? 0 : previous.consecutiveIncidents() + 1;
        LockType lockDemand = severity.atLeast(TamperSeverity.HIGH)
                ? LockType.strictest(previous.tamperLockDemand(), LockType.HARD)
                : previous.tamperLockDemand();
        ResponseAction action = actionFor(severity);
        Instant now = clock.instant();

        EscalationState next = new EscalationState(deviceId, count, severity, action, now, lockDemand);
        store.save(next);
        auditLog.logTransition(deviceId, previous.consecutiveIncidents(), count, severity.name(), action.name());
        if (severity != TamperSeverity.NONE) {
            log.warn("Device {} escalated: severity {}, consecutive incidents {}, flags {}",
                    deviceId, severity, count, status.flags());
        }

        List<EscalationOutcome.StepResult> steps = new ArrayList<>();
        switch (severity) {
            case NONE -> steps.add(step(deviceId, ResponseStep.RESTORE_CADENCE, () -> {
                cadence.restore(deviceId);
                return Result.ok();
            }));
            case LOW -> {
                steps.add(new EscalationOutcome.StepResult(ResponseStep.RECORD, true, "Recorded"));
                steps.add(step(deviceId, ResponseStep.RESTORE_CADENCE, () -> {
                    cadence.restore(deviceId);
                    return Result.ok();
                }));
            }
            case MEDIUM -> {
                steps.add(raiseCadence(deviceId));
                steps.add(queueAlert(deviceId, status, incident, next));
            }
            case HIGH -> {
                steps.add(raiseCadence(deviceId));
                steps.add(hardLock(deviceId));
                steps.addAll(disableFeatures(deviceId));
                steps.add(queueAlert(deviceId, status, incident, next));
            }
            case CRITICAL -> {
                steps.add(raiseCadence(deviceId));
                steps.add(hardLock(deviceId));
                steps.addAll(disableFeatures(deviceId));
                steps.add(step(deviceId, ResponseStep.WIPE_SENSITIVE_DATA, privilegeGateway::wipeSensitiveData));
                steps.add(queueAlert(deviceId, status, incident, next));
            }
        }
        return new EscalationOutcome(previous, next, action, steps);
    }

    /**
     * Records a backend lock command as a tamper lock demand and enforces it.
     */
    public EscalationOutcome demandLock(String deviceId, LockType type) {
        Objects.requireNonNull(type, "Lock type cannot be null");
        EscalationState previous = store.load(deviceId);
        EscalationState next = new EscalationState(deviceId, previous.consecutiveIncidents(), previous.lastSeverity(),
                ResponseAction.BACKEND_LOCK, clock.instant(), LockType.strictest(previous.tamperLockDemand(), type));
        store.save(next);
        log.warn("Backend requested {} lock for {}", type, deviceId);
        EscalationOutcome.StepResult lock = hardLock(deviceId);
        return new EscalationOutcome(previous, next, ResponseAction.BACKEND_LOCK, List.of(lock));
    }

    /**
     * Manual reset of the incident counter. Any lock demand stays in place.
     */
    public EscalationState reset(String deviceId, String reason) {
        EscalationState previous = store.load(deviceId);
        EscalationState next = new EscalationState(deviceId, 0, TamperSeverity.NONE, ResponseAction.MANUAL_RESET,
                clock.instant(), previous.tamperLockDemand());
        store.save(next);
        cadence.restore(deviceId);
        auditLog.record(AuditLog.EventType.ESCALATION_RESET, AuditLog.Severity.MEDIUM, "Escalation reset",
                Map.of("deviceId", deviceId, "reason", reason != null ? reason : "",
                        "from", String.valueOf(previous.consecutiveIncidents())));
        log.info("Escalation for {} reset ({}), was {} incidents", deviceId, reason, previous.consecutiveIncidents());
        return next;
    }

    /**
     * Backend clearance: counter to 0, tamper lock demand dropped, features re-enabled and
     * any tamper lock released. Payment locks are re-evaluated, not released.
     */
    public EscalationOutcome clear(String deviceId, String reason) {
        EscalationState previous = store.load(deviceId);
        EscalationState next = new EscalationState(deviceId, 0, TamperSeverity.NONE, ResponseAction.CLEARED,
                clock.instant(), null);
        store.save(next);
        cadence.restore(deviceId);

        List<EscalationOutcome.StepResult> steps = new ArrayList<>();
        steps.add(step(deviceId, ResponseStep.ENABLE_FEATURES, () -> {
            List<Result<Void>> results = List.of(
                    privilegeGateway.setCameraDisabled(false),
                    privilegeGateway.setUsbDisabled(false),
                    privilegeGateway.setDeveloperOptionsDisabled(false));
            return results.stream().filter(Result::isFailure).findFirst().orElse(Result.ok());
        }));

        lockManager.activeLock(deviceId)
                .filter(lock -> lock.reason() == LockReason.TAMPER)
                .ifPresent(lock -> lockManager.unlockFromBackend(deviceId, "CLEARANCE"));
        lockManager.enforce(deviceId);

        auditLog.record(AuditLog.EventType.ESCALATION_RESET, AuditLog.Severity.MEDIUM, "Backend clearance",
                Map.of("deviceId", deviceId, "reason", reason != null ? reason : "",
                        "from", String.valueOf(previous.consecutiveIncidents())));
        log.info("Device {} cleared by backend ({})", deviceId, reason);
        return new EscalationOutcome(previous, next, ResponseAction.CLEARED, steps);
    }

    // ==================== Response Steps ====================

    private static ResponseAction actionFor(TamperSeverity severity) {
        return switch (severity) {
            case NONE -> ResponseAction.NONE;
            case LOW -> ResponseAction.RECORD_ONLY;
            case MEDIUM -> ResponseAction.ALERT_AND_MONITOR;
            case HIGH -> ResponseAction.LOCK_AND_RESTRICT;
            case CRITICAL -> ResponseAction.LOCK_RESTRICT_AND_WIPE;
        };
    }

    private EscalationOutcome.StepResult raiseCadence(String deviceId) {
        return step(deviceId, ResponseStep.RAISE_CADENCE, () -> {
            cadence.raise(deviceId);
            return Result.ok();
        });
    }

    private EscalationOutcome.StepResult hardLock(String deviceId) {
        return step(deviceId, ResponseStep.HARD_LOCK, () -> {
            lockManager.renewDemand(deviceId, LockReason.TAMPER);
            if (lockManager.enforce(deviceId)) {
                return Result.ok();
            }
            return Result.<Void>failure(ErrorKind.PRIVILEGE_ACTION_FAILURE, "Platform did not confirm the lock");
        });
    }

    private List<EscalationOutcome.StepResult> disableFeatures(String deviceId) {
        return List.of(
                step(deviceId, ResponseStep.DISABLE_CAMERA, () -> privilegeGateway.setCameraDisabled(true)),
                step(deviceId, ResponseStep.DISABLE_USB, () -> privilegeGateway.setUsbDisabled(true)),
                step(deviceId, ResponseStep.DISABLE_DEVELOPER_OPTIONS,
                        () -> privilegeGateway.setDeveloperOptionsDisabled(true))
        );
    }

    private EscalationOutcome.StepResult queueAlert(String deviceId, TamperStatus status,
                                                    IncidentTicket incident, EscalationState state) {
        return step(deviceId, ResponseStep.QUEUE_ALERT, () -> {
            AlertSeverity severity = AlertSeverity.max(AlertSeverity.forTamper(status.severity()),
                    incident.minimumAlertSeverity());
            long incidents = incident.removal() ? incident.removalAttempt() : state.consecutiveIncidents();
            alertQueue.enqueue(new OfflineAlertQueue.AlertRequest(
                    deviceId,
                    incident.removal() ? incident.removalAttempt() : incident.attemptNumber(),
                    severity,
                    QueuedAlert.escalationLevelFor(incidents),
                    lockManager.isLocked(deviceId),
                    status.flags(),
                    status.timestamp()
            ));
            return Result.ok();
        });
    }

    private EscalationOutcome.StepResult step(String deviceId, ResponseStep step, Supplier<Result<?>> action) {
        Result<?> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            log.error("Response step {} for {} failed", step, deviceId, e);
            result = Result.failure(ErrorKind.PRIVILEGE_ACTION_FAILURE, e.getMessage());
        }
        if (step != ResponseStep.RAISE_CADENCE && step != ResponseStep.RESTORE_CADENCE) {
            auditLog.logResponseAction(deviceId, step.name(), result.isOk(), result.message());
        }
        return new EscalationOutcome.StepResult(step, result.isOk(), result.isOk() ? "OK" : result.message());
    }
}
