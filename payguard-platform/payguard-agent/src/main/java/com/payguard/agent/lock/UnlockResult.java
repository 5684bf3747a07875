package com.payguard.agent.lock;

public record UnlockResult(
        boolean success,
        int remainingAttempts,
        LockStatus status,
        String message
) {
    static UnlockResult rejected(int remainingAttempts, LockStatus status, String message) {
        return new UnlockResult(false, remainingAttempts, status, message);
    }
}
