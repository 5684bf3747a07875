package com.payguard.agent.baseline;

public enum BaselineOrigin {
    /** Captured locally when the device was first enrolled. */
    ENROLLMENT,
    /** Snapshot the backend verified in a heartbeat response. */
    BACKEND_CONFIRMED,
    /** Enrollment snapshot restored after the active baseline was lost. */
    RECOVERY
}
