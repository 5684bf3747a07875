package com.payguard.agent.snapshot;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Platform reads used to build a {@link DeviceSnapshot}.
 *
 * Every method may block or throw; the collector runs each read under a deadline and
 * marks the affected fields unavailable instead of failing the whole capture.
 */
public interface DeviceStateSource {

    String deviceId() throws Exception;

    String hardwareSerial() throws Exception;

    /**
     * Identifier of this agent installation; changes when the app is reinstalled.
     */
    String installId() throws Exception;

    BuildInfo buildInfo() throws Exception;

    /**
     * Read-only system properties (ro.build.tags, ro.boot.verifiedbootstate and so on).
     */
    Map<String, String> systemProperties() throws Exception;

    /**
     * Global settings relevant to posture: development_settings_enabled, adb_enabled.
     */
    Map<String, String> globalSettings() throws Exception;

    Set<String> installedPackages() throws Exception;

    boolean pathExists(String path) throws Exception;

    Integer batteryPercent() throws Exception;

    Long uptimeMillis() throws Exception;

    Optional<GeoFix> lastLocation() throws Exception;
}
