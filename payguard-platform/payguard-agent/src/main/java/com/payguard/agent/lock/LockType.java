package com.payguard.agent.lock;

/**
 * Lock strictness, weakest first.
 * SOFT is dismissible, HARD needs a PIN or the backend, PERMANENT needs the backend.
 */
public enum LockType {
    SOFT,
    HARD,
    PERMANENT;

    public boolean stricterThan(LockType other) {
        return other == null || compareTo(other) > 0;
    }

    public boolean pinUnlockable() {
        return this == SOFT || this == HARD;
    }

    /**
     * Stricter of two, null meaning no lock.
     */
    public static LockType strictest(LockType a, LockType b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
