package com.payguard.agent.snapshot;

import java.time.Instant;

/**
 * Last known location fix. Informational only, never compared.
 */
public record GeoFix(
        double latitude,
        double longitude,
        double accuracyMeters,
        Instant fixedAt
) {}
