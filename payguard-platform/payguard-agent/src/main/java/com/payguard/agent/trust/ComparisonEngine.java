package com.payguard.agent.trust;

import com.payguard.agent.snapshot.DeviceSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Compares a snapshot against a baseline and lists the differing fields.
 *
 * Pure and deterministic: no clock, no I/O, findings ordered by {@link ComparedField}.
 * A field missing from either side is skipped rather than reported, so a failed read
 * never looks like tampering.
 */
public class ComparisonEngine {

    public List<Finding> compare(DeviceSnapshot current, DeviceSnapshot baseline) {
        Objects.requireNonNull(current, "Current snapshot cannot be null");
        Objects.requireNonNull(baseline, "Baseline cannot be null");

        List<Finding> findings = new ArrayList<>();
        for (ComparedField field : ComparedField.values()) {
            Object oldValue = field.valueIn(baseline);
            Object newValue = field.valueIn(current);
            if (oldValue == null || newValue == null) {
                continue;
            }
            if (!Objects.equals(oldValue, newValue)) {
                findings.add(new Finding(
                        field,
                        field.category(),
                        String.valueOf(oldValue),
                        String.valueOf(newValue),
                        field.severity()
                ));
            }
        }
        return List.copyOf(findings);
    }
}
