package com.payguard.agent.lock;

import java.time.Instant;
import java.util.Objects;

/**
 * A lock applied to a device. Released records stay in the ledger history.
 *
 * @param enforced the platform confirmed the lock; SOFT locks need no platform call
 * @param suppressedDemand the weaker concurrent demand that this lock outranks
 */
public record LockRecord(
        String lockId,
        String deviceId,
        LockType lockType,
        LockReason reason,
        String message,
        String pinHash,
        String pinSalt,
        int maxAttempts,
        int failedAttempts,
        Instant createdAt,
        Instant expiresAt,
        LockStatus status,
        boolean enforced,
        LockDemand suppressedDemand,
        Instant releasedAt,
        String releasedBy
) {
    public LockRecord {
        Objects.requireNonNull(lockId, "Lock ID cannot be null");
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(lockType, "Lock type cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
        Objects.requireNonNull(status, "Status cannot be null");
    }

    public int remainingAttempts() {
        return Math.max(0, maxAttempts - failedAttempts);
    }

    public boolean hasPin() {
        return pinHash != null && pinSalt != null;
    }

    public boolean inForce() {
        return status != LockStatus.RELEASED;
    }

    public LockDemand demand() {
        return new LockDemand(lockType, reason, message);
    }

    LockRecord withFailedAttempt(int failed, LockStatus newStatus) {
        return new LockRecord(lockId, deviceId, lockType, reason, message, pinHash, pinSalt, maxAttempts,
                failed, createdAt, expiresAt, newStatus, enforced, suppressedDemand, releasedAt, releasedBy);
    }

    LockRecord withEnforced(boolean nowEnforced) {
        return new LockRecord(lockId, deviceId, lockType, reason, message, pinHash, pinSalt, maxAttempts,
                failedAttempts, createdAt, expiresAt, status, nowEnforced, suppressedDemand, releasedAt, releasedBy);
    }

    LockRecord withSuppressedDemand(LockDemand demand) {
        return new LockRecord(lockId, deviceId, lockType, reason, message, pinHash, pinSalt, maxAttempts,
                failedAttempts, createdAt, expiresAt, status, enforced, demand, releasedAt, releasedBy);
    }

    LockRecord withPin(PinCredential credential) {
        return new LockRecord(lockId, deviceId, lockType, reason, message, credential.hash(), credential.salt(),
                maxAttempts, failedAttempts, createdAt, expiresAt, status, enforced, suppressedDemand,
                releasedAt, releasedBy);
    }

    LockRecord released(Instant at, String by) {
        return new LockRecord(lockId, deviceId, lockType, reason, message, pinHash, pinSalt, maxAttempts,
                failedAttempts, createdAt, expiresAt, LockStatus.RELEASED, enforced, suppressedDemand, at, by);
    }
}
