package com.payguard.agent.escalation;

/**
 * Individual steps of a response, executed in declaration order.
 */
public enum ResponseStep {
    RECORD,
    RESTORE_CADENCE,
    RAISE_CADENCE,
    HARD_LOCK,
    DISABLE_CAMERA,
    DISABLE_USB,
    DISABLE_DEVELOPER_OPTIONS,
    WIPE_SENSITIVE_DATA,
    QUEUE_ALERT,
    ENABLE_FEATURES
}
