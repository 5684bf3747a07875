package com.payguard.agent.trust;

/**
 * Ordered tamper severity, NONE lowest.
 */
public enum TamperSeverity {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean atLeast(TamperSeverity other) {
        return compareTo(other) >= 0;
    }

    public static TamperSeverity max(TamperSeverity a, TamperSeverity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
