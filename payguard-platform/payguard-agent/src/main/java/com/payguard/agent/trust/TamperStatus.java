package com.payguard.agent.trust;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Classified result of one verification or one platform incident.
 *
 * {@code tampered} holds exactly when severity is above NONE. {@code inconclusive} marks a
 * verification that had no baseline to compare against.
 */
public record TamperStatus(
        boolean tampered,
        TamperSeverity severity,
        List<String> flags,
        Instant timestamp,
        boolean inconclusive
) {
    public static final String BASELINE_MISSING = "BASELINE_MISSING";

    public TamperStatus {
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        flags = flags != null ? List.copyOf(flags) : List.of();
        if (tampered != (severity != TamperSeverity.NONE)) {
            throw new IllegalArgumentException("tampered must match severity " + severity);
        }
    }

    public static TamperStatus of(TamperSeverity severity, List<String> flags, Instant timestamp) {
        return new TamperStatus(severity != TamperSeverity.NONE, severity, flags, timestamp, false);
    }

    public static TamperStatus clean(Instant timestamp) {
        return of(TamperSeverity.NONE, List.of(), timestamp);
    }

    /**
     * Verification without a baseline. Treated as NONE, reported separately.
     */
    public static TamperStatus inconclusive(Instant timestamp) {
        return new TamperStatus(false, TamperSeverity.NONE, List.of(BASELINE_MISSING), timestamp, true);
    }
}
