package com.payguard.agent.queue;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import com.payguard.agent.store.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable FIFO of backend alerts that survives restarts and network outages.
 *
 * Enqueue persists before returning and never touches the network. Drain delivers in
 * order and stops at the first failure, so a later alert is never delivered ahead of an
 * earlier one. When the queue is over its cap the oldest pending alerts are pruned,
 * with an audit entry for each.
 */
public class OfflineAlertQueue {

    private static final Logger log = LoggerFactory.getLogger(OfflineAlertQueue.class);
    private static final String KEY = "alerts.";

    private final StateRepository repository;
    private final AlertDispatcher dispatcher;
    private final AuditLog auditLog;
    private final Clock clock;
    private final int maxRetained;
    private final int deliveredHistory;
    private final Set<String> draining = ConcurrentHashMap.newKeySet();

    public OfflineAlertQueue(StateRepository repository, AlertDispatcher dispatcher, AuditLog auditLog,
                             Clock clock, int maxRetained, int deliveredHistory) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (maxRetained < 1) {
            throw new IllegalArgumentException("maxRetained must be positive");
        }
        this.maxRetained = maxRetained;
        this.deliveredHistory = Math.max(0, deliveredHistory);
    }

    // ==================== Enqueue ====================

    /**
     * Appends an alert to the device's queue. Durable when this returns.
     */
    public synchronized EnqueueResult enqueue(AlertRequest request) {
        Objects.requireNonNull(request, "Request cannot be null");

        QueuedAlert alert = new QueuedAlert(
                UUID.randomUUID().toString(),
                request.deviceId(),
                request.attemptNumber(),
                request.severity(),
                request.escalationLevel(),
                request.deviceLocked(),
                request.flags(),
                request.occurredAt(),
                clock.instant(),
                null,
                0,
                null
        );

        QueueState state = load(request.deviceId());
        List<QueuedAlert> pending = new ArrayList<>(state.pending());
        pending.add(alert);

        List<QueuedAlert> pruned = new ArrayList<>();
        while (pending.size() > maxRetained) {
            pruned.add(pending.remove(0));
        }

        save(request.deviceId(), new QueueState(pending, state.delivered()));

        for (QueuedAlert dropped : pruned) {
            log.warn("Alert queue for {} over capacity, dropped alert #{} ({})",
                    dropped.deviceId(), dropped.attemptNumber(), dropped.severity());
            auditLog.record(AuditLog.EventType.ALERT_PRUNED, AuditLog.Severity.LOW,
                    "Undelivered alert pruned",
                    Map.of(
                            "deviceId", dropped.deviceId(),
                            "alertId", dropped.alertId(),
                            "attemptNumber", String.valueOf(dropped.attemptNumber()),
                            "severity", dropped.severity().name()
                    ));
        }

        auditLog.record(AuditLog.EventType.ALERT_QUEUED, AuditLog.Severity.INFO, "Alert queued",
                Map.of(
                        "deviceId", alert.deviceId(),
                        "alertId", alert.alertId(),
                        "severity", alert.severity().name()
                ));
        return new EnqueueResult(true, alert.alertId(), pruned.size(),
                pruned.isEmpty() ? "Alert queued" : "Alert queued, " + pruned.size() + " oldest pruned");
    }

    // ==================== Drain ====================

    /**
     * Delivers pending alerts oldest first, stopping at the first failure.
     *
     * <p>The queue monitor is released while an alert is on the wire, so enqueue never waits
     * on the network. Only one drain per device delivers at a time; a concurrent call returns 0
     * and the running drain picks up whatever was queued meanwhile.</p>
     *
     * @return number of alerts delivered by this call
     */
    public int drain(String deviceId) {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        if (!draining.add(deviceId)) {
            log.debug("Alert queue for {} already draining", deviceId);
            return 0;
        }
        try {
            int count = 0;
            while (true) {
                QueuedAlert next = head(deviceId);
                if (next == null) {
                    break;
                }
                Result<Void> result = deliver(next);
                if (result.isFailure()) {
                    recordFailure(deviceId, next, result.message());
                    log.info("Alert delivery for {} paused after {} sent: {}", deviceId, count, result.message());
                    return count;
                }
                recordDelivery(deviceId, next);
                count++;
            }
            if (count > 0) {
                log.debug("Alert queue for {} drained, {} delivered", deviceId, count);
            }
            return count;
        } finally {
            draining.remove(deviceId);
        }
    }

    private synchronized QueuedAlert head(String deviceId) {
        List<QueuedAlert> pending = load(deviceId).pending();
        return pending.isEmpty() ? null : pending.get(0);
    }

    private synchronized void recordFailure(String deviceId, QueuedAlert alert, String reason) {
        QueueState state = load(deviceId);
        List<QueuedAlert> pending = new ArrayList<>(state.pending());
        int index = indexOf(pending, alert.alertId());
        if (index < 0) {
            return;
        }
        pending.set(index, pending.get(index).failedDelivery(reason));
        save(deviceId, new QueueState(pending, state.delivered()));
    }

    private synchronized void recordDelivery(String deviceId, QueuedAlert alert) {
        QueueState state = load(deviceId);
        List<QueuedAlert> pending = new ArrayList<>(state.pending());
        int index = indexOf(pending, alert.alertId());
        if (index >= 0) {
            pending.remove(index);
        }
        List<QueuedAlert> delivered = new ArrayList<>(state.delivered());
        delivered.add(alert.delivered(clock.instant()));
        while (delivered.size() > deliveredHistory) {
            delivered.remove(0);
        }
        save(deviceId, new QueueState(pending, delivered));
        auditLog.record(AuditLog.EventType.ALERT_DELIVERED, AuditLog.Severity.INFO, "Alert delivered",
                Map.of("deviceId", deviceId, "alertId", alert.alertId()));
    }

    private static int indexOf(List<QueuedAlert> alerts, String alertId) {
        for (int i = 0; i < alerts.size(); i++) {
            if (alerts.get(i).alertId().equals(alertId)) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Queries ====================

    public List<QueuedAlert> pending(String deviceId) {
        return load(deviceId).pending();
    }

    public List<QueuedAlert> delivered(String deviceId) {
        return load(deviceId).delivered();
    }

    public QueueStatus status(String deviceId) {
        QueueState state = load(deviceId);
        Instant oldest = state.pending().isEmpty() ? null : state.pending().get(0).queuedAt();
        return new QueueStatus(state.pending().size(), state.delivered().size(), oldest);
    }

    // ==================== Private Methods ====================

    private Result<Void> deliver(QueuedAlert alert) {
        try {
            Result<Void> result = dispatcher.deliver(alert);
            return result != null ? result : Result.ok();
        } catch (RuntimeException e) {
            return Result.failure(ErrorKind.NETWORK_FAILURE,
                    "Dispatcher error: " + e.getMessage());
        }
    }

    private QueueState load(String deviceId) {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        return repository.read(KEY + deviceId, QueueState.class).orElseGet(QueueState::empty);
    }

    private void save(String deviceId, QueueState state) {
        repository.write(KEY + deviceId, state);
    }

    // ==================== Inner Types ====================

    /**
     * Alert to enqueue. Identifiers and timestamps are assigned by the queue.
     */
    public record AlertRequest(
            String deviceId,
            long attemptNumber,
            AlertSeverity severity,
            int escalationLevel,
            boolean deviceLocked,
            List<String> flags,
            Instant occurredAt
    ) {
        public AlertRequest {
            Objects.requireNonNull(deviceId, "Device ID cannot be null");
            Objects.requireNonNull(severity, "Severity cannot be null");
            flags = flags != null ? List.copyOf(flags) : List.of();
        }
    }

    public record EnqueueResult(
            boolean success,
            String alertId,
            int prunedCount,
            String message
    ) {}

    public record QueueStatus(
            int pendingCount,
            int deliveredCount,
            Instant oldestPendingAt
    ) {}

    /**
     * Persisted queue of one device.
     */
    public record QueueState(
            List<QueuedAlert> pending,
            List<QueuedAlert> delivered
    ) {
        public QueueState {
            pending = pending != null ? List.copyOf(pending) : List.of();
            delivered = delivered != null ? List.copyOf(delivered) : List.of();
        }

        static QueueState empty() {
            return new QueueState(List.of(), List.of());
        }
    }
}
