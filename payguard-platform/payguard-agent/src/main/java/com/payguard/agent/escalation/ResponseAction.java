package com.payguard.agent.escalation;

/**
 * Response chosen for a transition, recorded as {@code lastActionTaken}.
 */
public enum ResponseAction {
    NONE,
    RECORD_ONLY,
    ALERT_AND_MONITOR,
    LOCK_AND_RESTRICT,
    LOCK_RESTRICT_AND_WIPE,
    BACKEND_LOCK,
    CLEARED,
    MANUAL_RESET
}
