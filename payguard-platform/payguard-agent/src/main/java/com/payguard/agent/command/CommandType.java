package com.payguard.agent.command;

public enum CommandType {
    LOCK_DEVICE,
    DISABLE_FEATURES,
    WIPE_DATA,
    ALERT_ONLY,
    DISABLE_CAMERA,
    DISABLE_USB,
    DISABLE_DEVELOPER_MODE,
    RESTRICT_NETWORK
}
