package com.payguard.agent.removal;

import com.payguard.agent.trust.ComparedField;
import com.payguard.agent.trust.TamperSeverity;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A platform notification delivered to the agent.
 *
 * @param detail package name for removal events, setting key for setting changes
 */
public record ProtectionEvent(
        String deviceId,
        ProtectionEventType type,
        String detail,
        Instant occurredAt
) {
    private static final Map<String, ComparedField> SETTING_FIELDS = Map.of(
            "development_settings_enabled", ComparedField.DEVELOPER_MODE,
            "adb_enabled", ComparedField.USB_DEBUGGING
    );

    public ProtectionEvent {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(occurredAt, "Occurred-at cannot be null");
    }

    /**
     * Flags the next poll is expected to report for the same condition.
     * A setting that maps to a compared field uses that field's flag.
     */
    public List<String> impliedFlags() {
        if (type == ProtectionEventType.PROTECTION_SETTING_CHANGED && detail != null) {
            ComparedField field = SETTING_FIELDS.get(detail);
            if (field != null) {
                return List.of(field.flag());
            }
        }
        return List.of(type.name());
    }

    /**
     * Severity of this event. A setting change inherits the severity of the field it maps to.
     */
    public TamperSeverity severity() {
        if (type == ProtectionEventType.PROTECTION_SETTING_CHANGED && detail != null) {
            ComparedField field = SETTING_FIELDS.get(detail);
            if (field != null) {
                return TamperSeverity.max(type.baseSeverity(), field.severity());
            }
        }
        return type.baseSeverity();
    }
}
