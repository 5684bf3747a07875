package com.payguard.agent.support;

import com.payguard.agent.snapshot.DeviceSnapshot;

import java.time.Instant;

/**
 * Snapshot fixtures.
 */
public final class Snapshots {

    private Snapshots() {}

    /**
     * A fully populated snapshot of an untampered device.
     */
    public static DeviceSnapshot clean(String deviceId, Instant capturedAt) {
        return DeviceSnapshot.builder()
                .deviceId(deviceId)
                .hardwareSerial("SER-" + deviceId)
                .installId("install-" + deviceId)
                .identityHash("identity-" + deviceId)
                .manufacturer("Acme")
                .model("Phone 7")
                .osVersion("14")
                .sdkLevel(34)
                .buildFingerprint("acme/phone7/14:user/release-keys")
                .securityPatch("2026-09-01")
                .rooted(false)
                .bootloaderUnlocked(false)
                .customRom(false)
                .usbDebugging(false)
                .developerMode(false)
                .appInventoryHash("apps-v1")
                .systemPropertiesHash("props-v1")
                .batteryPercent(80)
                .uptimeMillis(3_600_000L)
                .capturedAt(capturedAt)
                .build();
    }

    public static DeviceSnapshot clean(String deviceId) {
        return clean(deviceId, Instant.parse("2026-10-01T10:00:00Z"));
    }

    public static DeviceSnapshot rooted(String deviceId) {
        return clean(deviceId).toBuilder().rooted(true).build();
    }
}
