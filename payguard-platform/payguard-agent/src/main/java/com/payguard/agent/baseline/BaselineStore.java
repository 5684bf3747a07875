package com.payguard.agent.baseline;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.snapshot.DeviceSnapshot;
import com.payguard.agent.store.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Holds the active and enrollment baselines per device.
 *
 * Comparisons read under the read lock and {@link #commit} is the only path that replaces
 * the active baseline, so a comparison never observes a half-replaced reference. A commit
 * is persisted before the in-memory copy changes.
 */
public class BaselineStore {

    private static final Logger log = LoggerFactory.getLogger(BaselineStore.class);
    private static final String ACTIVE_KEY = "baseline.active.";
    private static final String ENROLLMENT_KEY = "baseline.enrollment.";

    private final StateRepository repository;
    private final AuditLog auditLog;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, BaselineReference> active = new ConcurrentHashMap<>();

    public BaselineStore(StateRepository repository, AuditLog auditLog, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Gets the active baseline, loading it from the store on first access.
     */
    public Optional<BaselineReference> active(String deviceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(active.computeIfAbsent(deviceId,
                    id -> repository.read(ACTIVE_KEY + id, BaselineReference.class).orElse(null)));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<BaselineReference> enrollment(String deviceId) {
        lock.readLock().lock();
        try {
            return repository.read(ENROLLMENT_KEY + deviceId, BaselineReference.class);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs a comparison against the active baseline while holding the read lock.
     */
    public <T> T withActive(String deviceId, Function<Optional<BaselineReference>, T> comparison) {
        lock.readLock().lock();
        try {
            return comparison.apply(active(deviceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Records the enrollment snapshot and makes it the active baseline.
     */
    public BaselineReference enroll(String deviceId, DeviceSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        lock.writeLock().lock();
        try {
            BaselineReference reference = new BaselineReference(deviceId, snapshot, BaselineOrigin.ENROLLMENT, clock.instant());
            repository.write(ENROLLMENT_KEY + deviceId, reference);
            repository.write(ACTIVE_KEY + deviceId, reference);
            active.put(deviceId, reference);
            log.info("Device {} enrolled, baseline captured at {}", deviceId, snapshot.capturedAt());
            auditCommit(reference);
            return reference;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the active baseline. The single write path for the active reference.
     */
    public BaselineReference commit(String deviceId, DeviceSnapshot snapshot, BaselineOrigin origin) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        Objects.requireNonNull(origin, "Origin cannot be null");
        lock.writeLock().lock();
        try {
            BaselineReference reference = new BaselineReference(deviceId, snapshot, origin, clock.instant());
            repository.write(ACTIVE_KEY + deviceId, reference);
            active.put(deviceId, reference);
            log.debug("Baseline for {} committed from {}", deviceId, origin);
            auditCommit(reference);
            return reference;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Restores the enrollment snapshot as the active baseline.
     *
     * @return the recovered reference, or empty when the device was never enrolled
     */
    public Optional<BaselineReference> recover(String deviceId) {
        lock.writeLock().lock();
        try {
            Optional<BaselineReference> enrolled = enrollment(deviceId);
            if (enrolled.isEmpty()) {
                log.warn("Cannot recover baseline for {}: no enrollment snapshot", deviceId);
                return Optional.empty();
            }
            return Optional.of(commit(deviceId, enrolled.get().snapshot(), BaselineOrigin.RECOVERY));
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void auditCommit(BaselineReference reference) {
        auditLog.record(AuditLog.EventType.BASELINE_COMMITTED, AuditLog.Severity.INFO,
                "Baseline committed",
                Map.of(
                        "deviceId", reference.deviceId(),
                        "origin", reference.origin().name(),
                        "capturedAt", reference.snapshot().capturedAt().toString()
                ));
    }
}
