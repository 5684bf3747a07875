package com.payguard.agent.trust;

import java.util.Objects;

/**
 * One field that differs between the current snapshot and the baseline.
 */
public record Finding(
        ComparedField field,
        FindingCategory category,
        String oldValue,
        String newValue,
        TamperSeverity severity
) {
    public Finding {
        Objects.requireNonNull(field, "Field cannot be null");
        Objects.requireNonNull(category, "Category cannot be null");
        Objects.requireNonNull(severity, "Severity cannot be null");
    }
}
