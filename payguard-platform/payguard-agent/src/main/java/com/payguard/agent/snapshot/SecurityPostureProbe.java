package com.payguard.agent.snapshot;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives security posture flags (root, bootloader, custom ROM, USB debugging,
 * developer mode) from raw platform reads.
 *
 * A flag is {@code true} as soon as one indicator is found, {@code false} only when every
 * input it depends on was read, and {@code null} (unavailable) otherwise.
 */
public class SecurityPostureProbe {

    public static final Set<String> ROOT_PATHS = Set.of(
            "/system/app/Superuser.apk",
            "/system/xbin/su",
            "/system/bin/su",
            "/sbin/su",
            "/data/local/xbin/su",
            "/data/local/bin/su",
            "/data/local/su",
            "/system/sd/xbin/su",
            "/system/bin/failsafe/su",
            "/system/usr/we-need-root/su"
    );

    private static final Set<String> ROOT_PACKAGES = Set.of(
            "com.noshufou.android.su",
            "com.thirdparty.superuser",
            "eu.chainfire.supersu",
            "com.koushikdutta.superuser",
            "com.zachspong.temprootremovejb",
            "com.ramdroid.appquarantine",
            "com.topjohnwu.magisk"
    );

    private static final Set<String> HOOK_FRAMEWORKS = Set.of(
            "com.saurik.substrate",
            "de.robv.android.xposed",
            "de.robv.android.xposed.installer",
            "me.weishu.exp",
            "com.swift.sandhook"
    );

    private static final Set<String> CUSTOM_ROM_PROPERTIES = Set.of(
            "ro.modversion",
            "ro.cm.version",
            "ro.lineage.version"
    );

    /**
     * Assesses posture from whatever inputs could be read. Any argument may be null.
     *
     * @param systemProperties read-only system properties
     * @param globalSettings global settings
     * @param installedPackages installed package names
     * @param presentRootPaths subset of {@link #ROOT_PATHS} that exist on the device
     */
    public PostureAssessment assess(
            Map<String, String> systemProperties,
            Map<String, String> globalSettings,
            Set<String> installedPackages,
            Set<String> presentRootPaths) {

        Set<PostureSignal> signals = new LinkedHashSet<>();
        Set<String> warnings = new LinkedHashSet<>();

        Boolean rooted = detectRoot(systemProperties, installedPackages, presentRootPaths, signals, warnings);
        Boolean bootloaderUnlocked = detectBootloader(systemProperties, signals, warnings);
        Boolean customRom = detectCustomRom(systemProperties, signals, warnings);
        Boolean developerMode = settingEnabled(globalSettings, "development_settings_enabled",
                PostureSignal.DEVELOPER_OPTIONS_ENABLED, "Developer options are enabled", signals, warnings);
        Boolean usbDebugging = settingEnabled(globalSettings, "adb_enabled",
                PostureSignal.USB_DEBUGGING_ENABLED, "USB debugging is enabled", signals, warnings);

        return new PostureAssessment(
                rooted,
                bootloaderUnlocked,
                customRom,
                usbDebugging,
                developerMode,
                Collections.unmodifiableSet(signals),
                Collections.unmodifiableSet(warnings)
        );
    }

    private Boolean detectRoot(Map<String, String> systemProperties, Set<String> installedPackages,
                               Set<String> presentRootPaths, Set<PostureSignal> signals, Set<String> warnings) {
        boolean rootDetected = false;

        if (presentRootPaths != null) {
            for (String path : presentRootPaths) {
                if (ROOT_PATHS.contains(path)) {
                    rootDetected = true;
                    warnings.add("Root binary found at: " + path);
                    break;
                }
            }
        }

        if (installedPackages != null) {
            for (String pkg : ROOT_PACKAGES) {
                if (installedPackages.contains(pkg)) {
                    rootDetected = true;
                    warnings.add("Root package installed: " + pkg);
                    break;
                }
            }
            if (installedPackages.contains("com.topjohnwu.magisk")) {
                signals.add(PostureSignal.MAGISK_DETECTED);
            }
            for (String framework : HOOK_FRAMEWORKS) {
                if (installedPackages.contains(framework)) {
                    rootDetected = true;
                    signals.add(PostureSignal.HOOK_FRAMEWORK_DETECTED);
                    warnings.add("Hook framework detected: " + framework);
                }
            }
        }

        if (systemProperties != null) {
            String buildTags = systemProperties.getOrDefault("ro.build.tags", "");
            if (buildTags.contains("test-keys")) {
                rootDetected = true;
                warnings.add("Device built with test-keys");
            }
        }

        if (rootDetected) {
            signals.add(PostureSignal.ROOT_DETECTED);
            return true;
        }
        boolean allInputsRead = systemProperties != null && installedPackages != null && presentRootPaths != null;
        return allInputsRead ? Boolean.FALSE : null;
    }

    private Boolean detectBootloader(Map<String, String> systemProperties,
                                     Set<PostureSignal> signals, Set<String> warnings) {
        if (systemProperties == null) {
            return null;
        }
        String bootState = systemProperties.getOrDefault("ro.boot.verifiedbootstate", "");
        String flashLocked = systemProperties.getOrDefault("ro.boot.flash.locked", "");
        String deviceState = systemProperties.getOrDefault("ro.boot.vbmeta.device_state", "");

        if ("orange".equalsIgnoreCase(bootState) || "yellow".equalsIgnoreCase(bootState)
                || "0".equals(flashLocked) || "unlocked".equalsIgnoreCase(deviceState)) {
            signals.add(PostureSignal.BOOTLOADER_UNLOCKED);
            warnings.add("Bootloader is unlocked");
            return true;
        }
        if ("green".equalsIgnoreCase(bootState)) {
            signals.add(PostureSignal.BOOTLOADER_LOCKED);
        }
        return false;
    }

    private Boolean detectCustomRom(Map<String, String> systemProperties,
                                    Set<PostureSignal> signals, Set<String> warnings) {
        if (systemProperties == null) {
            return null;
        }
        boolean customRom = systemProperties.getOrDefault("ro.build.tags", "").contains("test-keys");
        for (String property : CUSTOM_ROM_PROPERTIES) {
            String value = systemProperties.get(property);
            if (value != null && !value.isBlank()) {
                customRom = true;
                warnings.add("Custom ROM property present: " + property);
            }
        }
        if (customRom) {
            signals.add(PostureSignal.CUSTOM_ROM_DETECTED);
        }
        return customRom;
    }

    private Boolean settingEnabled(Map<String, String> globalSettings, String key, PostureSignal signal,
                                   String warning, Set<PostureSignal> signals, Set<String> warnings) {
        if (globalSettings == null) {
            return null;
        }
        if ("1".equals(globalSettings.getOrDefault(key, "0"))) {
            signals.add(signal);
            warnings.add(warning);
            return true;
        }
        return false;
    }

    // ==================== Inner Types ====================

    public enum PostureSignal {
        ROOT_DETECTED,
        MAGISK_DETECTED,
        HOOK_FRAMEWORK_DETECTED,
        BOOTLOADER_UNLOCKED,
        BOOTLOADER_LOCKED,
        CUSTOM_ROM_DETECTED,
        DEVELOPER_OPTIONS_ENABLED,
        USB_DEBUGGING_ENABLED
    }

    /**
     * Result of a posture assessment. Null flags mean the inputs could not be read.
     */
    public record PostureAssessment(
            Boolean rooted,
            Boolean bootloaderUnlocked,
            Boolean customRom,
            Boolean usbDebugging,
            Boolean developerMode,
            Set<PostureSignal> signals,
            Set<String> warnings
    ) {}
}
