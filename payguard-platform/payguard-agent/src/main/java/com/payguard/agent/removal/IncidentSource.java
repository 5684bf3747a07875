package com.payguard.agent.removal;

public enum IncidentSource {
    POLL,
    PLATFORM_NOTIFICATION
}
