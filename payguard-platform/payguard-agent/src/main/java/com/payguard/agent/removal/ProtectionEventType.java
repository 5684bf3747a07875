package com.payguard.agent.removal;

import com.payguard.agent.trust.TamperSeverity;

/**
 * Platform notifications that indicate an attempt to remove or weaken the agent.
 */
public enum ProtectionEventType {
    /** A protected setting changed (developer options, USB debugging and similar). */
    PROTECTION_SETTING_CHANGED(TamperSeverity.LOW, true),
    PACKAGE_REMOVAL_ATTEMPT(TamperSeverity.HIGH, false),
    DEVICE_ADMIN_DISABLE_REQUESTED(TamperSeverity.HIGH, false),
    DEVICE_ADMIN_REVOKED(TamperSeverity.CRITICAL, false);

    private final TamperSeverity baseSeverity;
    private final boolean settingChange;

    ProtectionEventType(TamperSeverity baseSeverity, boolean settingChange) {
        this.baseSeverity = baseSeverity;
        this.settingChange = settingChange;
    }

    public TamperSeverity baseSeverity() {
        return baseSeverity;
    }

    /**
     * Removal attempts count toward the attempt-based alert severity; setting changes do not.
     */
    public boolean removalAttempt() {
        return !settingChange;
    }
}
