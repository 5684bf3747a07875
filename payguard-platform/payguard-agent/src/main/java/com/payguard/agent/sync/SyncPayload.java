package com.payguard.agent.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.payguard.agent.snapshot.DeviceSnapshot;
import com.payguard.agent.trust.TamperSeverity;

import java.time.Instant;
import java.util.List;

/**
 * Heartbeat body: the current snapshot with the local verdict and lock state.
 * {@code deviceId} is the configured identifier, which stays set even when the snapshot
 * could not read it.
 */
public record SyncPayload(
        String deviceId,
        Instant timestamp,
        DeviceSnapshot snapshot,
        TamperSeverity tamperSeverity,
        List<String> tamperFlags,
        @JsonProperty("isLocked") boolean locked,
        SyncStatus syncStatus
) {
    public SyncPayload {
        tamperFlags = tamperFlags != null ? List.copyOf(tamperFlags) : List.of();
    }
}
