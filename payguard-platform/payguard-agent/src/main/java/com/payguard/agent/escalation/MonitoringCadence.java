package com.payguard.agent.escalation;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Poll interval per device. Shortened while a device is under MEDIUM or higher escalation.
 */
public class MonitoringCadence {

    private final Duration normalInterval;
    private final Duration acceleratedInterval;
    private final Map<String, Boolean> accelerated = new ConcurrentHashMap<>();

    public MonitoringCadence(Duration normalInterval, Duration acceleratedInterval) {
        this.normalInterval = Objects.requireNonNull(normalInterval, "Normal interval cannot be null");
        this.acceleratedInterval = Objects.requireNonNull(acceleratedInterval, "Accelerated interval cannot be null");
        if (acceleratedInterval.compareTo(normalInterval) > 0) {
            throw new IllegalArgumentException("Accelerated interval cannot exceed the normal interval");
        }
    }

    public void raise(String deviceId) {
        accelerated.put(deviceId, Boolean.TRUE);
    }

    public void restore(String deviceId) {
        accelerated.remove(deviceId);
    }

    public boolean raised(String deviceId) {
        return accelerated.containsKey(deviceId);
    }

    public Duration intervalFor(String deviceId) {
        return raised(deviceId) ? acceleratedInterval : normalInterval;
    }
}
