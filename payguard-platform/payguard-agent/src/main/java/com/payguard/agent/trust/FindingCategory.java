package com.payguard.agent.trust;

public enum FindingCategory {
    HARDWARE,
    SOFTWARE,
    SECURITY,
    NETWORK
}
