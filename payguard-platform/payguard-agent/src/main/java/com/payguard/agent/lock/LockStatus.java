package com.payguard.agent.lock;

public enum LockStatus {
    ACTIVE,
    /** PIN attempts used up; only the backend can release the lock now. */
    PIN_EXHAUSTED,
    RELEASED
}
