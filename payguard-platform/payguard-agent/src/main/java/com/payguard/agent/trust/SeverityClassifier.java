package com.payguard.agent.trust;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reduces findings to a single {@link TamperStatus}: the highest finding severity,
 * NONE when there are no findings.
 */
public class SeverityClassifier {

    public TamperStatus classify(List<Finding> findings, Instant at) {
        Objects.requireNonNull(findings, "Findings cannot be null");
        Objects.requireNonNull(at, "Timestamp cannot be null");

        TamperSeverity severity = TamperSeverity.NONE;
        Set<String> flags = new LinkedHashSet<>();
        for (Finding finding : findings) {
            severity = TamperSeverity.max(severity, finding.severity());
            flags.add(finding.field().flag());
        }
        return TamperStatus.of(severity, List.copyOf(flags), at);
    }
}
