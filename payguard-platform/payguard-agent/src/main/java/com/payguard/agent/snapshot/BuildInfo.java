package com.payguard.agent.snapshot;

/**
 * Operating system build descriptors as reported by the platform.
 */
public record BuildInfo(
        String manufacturer,
        String model,
        String osVersion,
        Integer sdkLevel,
        String buildFingerprint,
        String securityPatch
) {}
