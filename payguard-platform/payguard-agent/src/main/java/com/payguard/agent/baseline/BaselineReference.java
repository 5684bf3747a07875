package com.payguard.agent.baseline;

import com.payguard.agent.snapshot.DeviceSnapshot;

import java.time.Instant;
import java.util.Objects;

/**
 * A snapshot accepted as the reference state of a device.
 */
public record BaselineReference(
        String deviceId,
        DeviceSnapshot snapshot,
        BaselineOrigin origin,
        Instant committedAt
) {
    public BaselineReference {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        Objects.requireNonNull(origin, "Origin cannot be null");
        Objects.requireNonNull(committedAt, "Committed-at cannot be null");
    }
}
