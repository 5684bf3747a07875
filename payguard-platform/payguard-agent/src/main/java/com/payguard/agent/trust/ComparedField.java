package com.payguard.agent.trust;

import com.payguard.agent.snapshot.DeviceSnapshot;

import java.util.function.Function;

/**
 * Fields compared against the baseline, in reporting order, with their fixed category
 * and severity. Telemetry (battery, uptime, location) and build descriptors are never
 * compared.
 */
public enum ComparedField {
    DEVICE_ID(DeviceSnapshot.DEVICE_ID, FindingCategory.HARDWARE, TamperSeverity.CRITICAL, DeviceSnapshot::deviceId),
    HARDWARE_SERIAL(DeviceSnapshot.HARDWARE_SERIAL, FindingCategory.HARDWARE, TamperSeverity.CRITICAL, DeviceSnapshot::hardwareSerial),
    INSTALL_ID(DeviceSnapshot.INSTALL_ID, FindingCategory.SOFTWARE, TamperSeverity.CRITICAL, DeviceSnapshot::installId),
    IDENTITY_HASH(DeviceSnapshot.IDENTITY_HASH, FindingCategory.HARDWARE, TamperSeverity.CRITICAL, DeviceSnapshot::identityHash),
    ROOTED(DeviceSnapshot.ROOTED, FindingCategory.SECURITY, TamperSeverity.HIGH, DeviceSnapshot::rooted),
    BOOTLOADER_UNLOCKED(DeviceSnapshot.BOOTLOADER_UNLOCKED, FindingCategory.SECURITY, TamperSeverity.HIGH, DeviceSnapshot::bootloaderUnlocked),
    CUSTOM_ROM(DeviceSnapshot.CUSTOM_ROM, FindingCategory.SECURITY, TamperSeverity.HIGH, DeviceSnapshot::customRom),
    USB_DEBUGGING(DeviceSnapshot.USB_DEBUGGING, FindingCategory.SECURITY, TamperSeverity.MEDIUM, DeviceSnapshot::usbDebugging),
    DEVELOPER_MODE(DeviceSnapshot.DEVELOPER_MODE, FindingCategory.SECURITY, TamperSeverity.MEDIUM, DeviceSnapshot::developerMode),
    APP_INVENTORY_HASH(DeviceSnapshot.APP_INVENTORY_HASH, FindingCategory.SOFTWARE, TamperSeverity.MEDIUM, DeviceSnapshot::appInventoryHash),
    SYSTEM_PROPERTIES_HASH(DeviceSnapshot.SYSTEM_PROPERTIES_HASH, FindingCategory.SOFTWARE, TamperSeverity.MEDIUM, DeviceSnapshot::systemPropertiesHash);

    private final String fieldName;
    private final FindingCategory category;
    private final TamperSeverity severity;
    private final Function<DeviceSnapshot, Object> extractor;

    ComparedField(String fieldName, FindingCategory category, TamperSeverity severity,
                  Function<DeviceSnapshot, Object> extractor) {
        this.fieldName = fieldName;
        this.category = category;
        this.severity = severity;
        this.extractor = extractor;
    }

    public String fieldName() {
        return fieldName;
    }

    public FindingCategory category() {
        return category;
    }

    public TamperSeverity severity() {
        return severity;
    }

    /**
     * Flag reported in TamperStatus when this field differs.
     */
    public String flag() {
        return name();
    }

    /**
     * Value of this field in the snapshot, or null when it was not read.
     */
    public Object valueIn(DeviceSnapshot snapshot) {
        if (!snapshot.hasField(fieldName)) {
            return null;
        }
        return extractor.apply(snapshot);
    }
}
