package com.payguard.agent.snapshot;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Point-in-time capture of device identity, build, security posture and telemetry.
 *
 * Fields that could not be read hold a sentinel ({@code ""} for text, {@code null} for
 * flags and numbers) and are named in {@link #unavailableFields()}. Immutable once captured.
 */
public record DeviceSnapshot(
        String deviceId,
        String hardwareSerial,
        String installId,
        String identityHash,
        String manufacturer,
        String model,
        String osVersion,
        Integer sdkLevel,
        String buildFingerprint,
        String securityPatch,
        Boolean rooted,
        Boolean bootloaderUnlocked,
        Boolean customRom,
        Boolean usbDebugging,
        Boolean developerMode,
        String appInventoryHash,
        String systemPropertiesHash,
        Integer batteryPercent,
        Long uptimeMillis,
        GeoFix location,
        Instant capturedAt,
        List<String> unavailableFields
) {

    public static final String UNAVAILABLE = "";

    public static final String DEVICE_ID = "deviceId";
    public static final String HARDWARE_SERIAL = "hardwareSerial";
    public static final String INSTALL_ID = "installId";
    public static final String IDENTITY_HASH = "identityHash";
    public static final String BUILD = "build";
    public static final String ROOTED = "rooted";
    public static final String BOOTLOADER_UNLOCKED = "bootloaderUnlocked";
    public static final String CUSTOM_ROM = "customRom";
    public static final String USB_DEBUGGING = "usbDebugging";
    public static final String DEVELOPER_MODE = "developerMode";
    public static final String APP_INVENTORY_HASH = "appInventoryHash";
    public static final String SYSTEM_PROPERTIES_HASH = "systemPropertiesHash";
    public static final String BATTERY = "batteryPercent";
    public static final String UPTIME = "uptimeMillis";
    public static final String LOCATION = "location";

    public DeviceSnapshot {
        Objects.requireNonNull(capturedAt, "Captured-at cannot be null");
        deviceId = textOrSentinel(deviceId);
        hardwareSerial = textOrSentinel(hardwareSerial);
        installId = textOrSentinel(installId);
        identityHash = textOrSentinel(identityHash);
        manufacturer = textOrSentinel(manufacturer);
        model = textOrSentinel(model);
        osVersion = textOrSentinel(osVersion);
        buildFingerprint = textOrSentinel(buildFingerprint);
        securityPatch = textOrSentinel(securityPatch);
        appInventoryHash = textOrSentinel(appInventoryHash);
        systemPropertiesHash = textOrSentinel(systemPropertiesHash);
        unavailableFields = unavailableFields != null
                ? List.copyOf(new TreeSet<>(unavailableFields))
                : List.of();
    }

    /**
     * Whether the named field was read successfully.
     */
    public boolean hasField(String field) {
        return !unavailableFields.contains(field);
    }

    public boolean complete() {
        return unavailableFields.isEmpty();
    }

    public Builder toBuilder() {
        return new Builder()
                .deviceId(deviceId)
                .hardwareSerial(hardwareSerial)
                .installId(installId)
                .identityHash(identityHash)
                .manufacturer(manufacturer)
                .model(model)
                .osVersion(osVersion)
                .sdkLevel(sdkLevel)
                .buildFingerprint(buildFingerprint)
                .securityPatch(securityPatch)
                .rooted(rooted)
                .bootloaderUnlocked(bootloaderUnlocked)
                .customRom(customRom)
                .usbDebugging(usbDebugging)
                .developerMode(developerMode)
                .appInventoryHash(appInventoryHash)
                .systemPropertiesHash(systemPropertiesHash)
                .batteryPercent(batteryPercent)
                .uptimeMillis(uptimeMillis)
                .location(location)
                .capturedAt(capturedAt)
                .unavailableFields(unavailableFields);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String textOrSentinel(String value) {
        return value != null ? value : UNAVAILABLE;
    }

    /**
     * Builder for snapshots; the collector fills fields as probes complete.
     */
    public static final class Builder {
        private String deviceId;
        private String hardwareSerial;
        private String installId;
        private String identityHash;
        private String manufacturer;
        private String model;
        private String osVersion;
        private Integer sdkLevel;
        private String buildFingerprint;
        private String securityPatch;
        private Boolean rooted;
        private Boolean bootloaderUnlocked;
        private Boolean customRom;
        private Boolean usbDebugging;
        private Boolean developerMode;
        private String appInventoryHash;
        private String systemPropertiesHash;
        private Integer batteryPercent;
        private Long uptimeMillis;
        private GeoFix location;
        private Instant capturedAt;
        private final TreeSet<String> unavailableFields = new TreeSet<>();

        public Builder deviceId(String deviceId) { this.deviceId = deviceId; return this; }
        public Builder hardwareSerial(String hardwareSerial) { this.hardwareSerial = hardwareSerial; return this; }
        public Builder installId(String installId) { this.installId = installId; return this; }
        public Builder identityHash(String identityHash) { this.identityHash = identityHash; return this; }
        public Builder manufacturer(String manufacturer) { this.manufacturer = manufacturer; return this; }
        public Builder model(String model) { this.model = model; return this; }
        public Builder osVersion(String osVersion) { this.osVersion = osVersion; return this; }
        public Builder sdkLevel(Integer sdkLevel) { this.sdkLevel = sdkLevel; return this; }
        public Builder buildFingerprint(String buildFingerprint) { this.buildFingerprint = buildFingerprint; return this; }
        public Builder securityPatch(String securityPatch) { this.securityPatch = securityPatch; return this; }
        public Builder rooted(Boolean rooted) { this.rooted = rooted; return this; }
        public Builder bootloaderUnlocked(Boolean bootloaderUnlocked) { this.bootloaderUnlocked = bootloaderUnlocked; return this; }
        public Builder customRom(Boolean customRom) { this.customRom = customRom; return this; }
        public Builder usbDebugging(Boolean usbDebugging) { this.usbDebugging = usbDebugging; return this; }
        public Builder developerMode(Boolean developerMode) { this.developerMode = developerMode; return this; }
        public Builder appInventoryHash(String appInventoryHash) { this.appInventoryHash = appInventoryHash; return this; }
        public Builder systemPropertiesHash(String systemPropertiesHash) { this.systemPropertiesHash = systemPropertiesHash; return this; }
        public Builder batteryPercent(Integer batteryPercent) { this.batteryPercent = batteryPercent; return this; }
        public Builder uptimeMillis(Long uptimeMillis) { this.uptimeMillis = uptimeMillis; return this; }
        public Builder location(GeoFix location) { this.location = location; return this; }
        public Builder capturedAt(Instant capturedAt) { this.capturedAt = capturedAt; return this; }

        public Builder unavailable(String field) {
            unavailableFields.add(field);
            return this;
        }

        public Builder unavailableFields(Collection<String> fields) {
            unavailableFields.clear();
            unavailableFields.addAll(fields);
            return this;
        }

        public Builder available(String field) {
            unavailableFields.remove(field);
            return this;
        }

        public DeviceSnapshot build() {
            return new DeviceSnapshot(deviceId, hardwareSerial, installId, identityHash,
                    manufacturer, model, osVersion, sdkLevel, buildFingerprint, securityPatch,
                    rooted, bootloaderUnlocked, customRom, usbDebugging, developerMode,
                    appInventoryHash, systemPropertiesHash, batteryPercent, uptimeMillis, location,
                    capturedAt, List.copyOf(unavailableFields));
        }
    }
}
