package com.payguard.agent.queue;

import com.payguard.agent.trust.TamperSeverity;

/**
 * Severity of a backend alert, lowest first.
 */
public enum AlertSeverity {
    WARNING,
    HIGH,
    CRITICAL;

    static final int HIGH_ATTEMPT_THRESHOLD = 2;
    static final int CRITICAL_ATTEMPT_THRESHOLD = 3;

    /**
     * Alert severity for a tamper severity. NONE and LOW map to WARNING.
     */
    public static AlertSeverity forTamper(TamperSeverity severity) {
        return switch (severity) {
            case NONE, LOW, MEDIUM -> WARNING;
            case HIGH -> HIGH;
            case CRITICAL -> CRITICAL;
        };
    }

    /**
     * Alert severity implied by the n-th removal attempt: the first is a warning,
     * the second high, the third and later critical.
     */
    public static AlertSeverity forAttempt(long attemptNumber) {
        if (attemptNumber < HIGH_ATTEMPT_THRESHOLD) {
            return WARNING;
        }
        if (attemptNumber < CRITICAL_ATTEMPT_THRESHOLD) {
            return HIGH;
        }
        return CRITICAL;
    }

    public static AlertSeverity max(AlertSeverity a, AlertSeverity b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }
}
