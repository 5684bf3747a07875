package com.payguard.agent.snapshot;

import com.payguard.agent.error.BoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Captures a {@link DeviceSnapshot} from the platform.
 *
 * All reads run concurrently under one collective deadline. A read that throws or
 * misses the deadline leaves its fields at the sentinel and names them in
 * {@code unavailableFields}; capture itself never fails.
 */
public class SnapshotCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SnapshotCollector.class);

    private final DeviceStateSource source;
    private final SecurityPostureProbe postureProbe;
    private final Duration captureTimeout;
    private final Clock clock;
    private final ExecutorService executor;

    public SnapshotCollector(DeviceStateSource source, SecurityPostureProbe postureProbe,
                             Duration captureTimeout, Clock clock) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.postureProbe = Objects.requireNonNull(postureProbe, "Posture probe cannot be null");
        this.captureTimeout = Objects.requireNonNull(captureTimeout, "Capture timeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.executor = Executors.newCachedThreadPool(BoundedCall.daemonThreads("snapshot-probe"));
    }

    /**
     * Captures the current device state.
     */
    public DeviceSnapshot capture() {
        long deadline = System.nanoTime() + captureTimeout.toNanos();
        Set<String> failedReads = new LinkedHashSet<>();

        Future<String> deviceIdRead = executor.submit(source::deviceId);
        Future<String> serialRead = executor.submit(source::hardwareSerial);
        Future<String> installIdRead = executor.submit(source::installId);
        Future<BuildInfo> buildRead = executor.submit(source::buildInfo);
        Future<Map<String, String>> propertiesRead = executor.submit(source::systemProperties);
        Future<Map<String, String>> settingsRead = executor.submit(source::globalSettings);
        Future<Set<String>> packagesRead = executor.submit(source::installedPackages);
        Future<Set<String>> rootPathsRead = executor.submit(this::presentRootPaths);
        Future<Integer> batteryRead = executor.submit(source::batteryPercent);
        Future<Long> uptimeRead = executor.submit(source::uptimeMillis);
        Future<Optional<GeoFix>> locationRead = executor.submit(source::lastLocation);

        String deviceId = blankToNull(await(deviceIdRead, deadline, DeviceSnapshot.DEVICE_ID, failedReads));
        String serial = blankToNull(await(serialRead, deadline, DeviceSnapshot.HARDWARE_SERIAL, failedReads));
        String installId = blankToNull(await(installIdRead, deadline, DeviceSnapshot.INSTALL_ID, failedReads));
        BuildInfo build = await(buildRead, deadline, DeviceSnapshot.BUILD, failedReads);
        Map<String, String> properties = await(propertiesRead, deadline, "systemProperties", failedReads);
        Map<String, String> settings = await(settingsRead, deadline, "globalSettings", failedReads);
        Set<String> packages = await(packagesRead, deadline, "installedPackages", failedReads);
        Set<String> rootPaths = await(rootPathsRead, deadline, "rootPaths", failedReads);
        Integer battery = await(batteryRead, deadline, DeviceSnapshot.BATTERY, failedReads);
        Long uptime = await(uptimeRead, deadline, DeviceSnapshot.UPTIME, failedReads);
        Optional<GeoFix> location = await(locationRead, deadline, DeviceSnapshot.LOCATION, failedReads);

        DeviceSnapshot.Builder builder = DeviceSnapshot.builder().capturedAt(clock.instant());

        builder.deviceId(deviceId).hardwareSerial(serial).installId(installId);
        markIfMissing(builder, DeviceSnapshot.DEVICE_ID, deviceId);
        markIfMissing(builder, DeviceSnapshot.HARDWARE_SERIAL, serial);
        markIfMissing(builder, DeviceSnapshot.INSTALL_ID, installId);

        if (build != null) {
            builder.manufacturer(build.manufacturer())
                    .model(build.model())
                    .osVersion(build.osVersion())
                    .sdkLevel(build.sdkLevel())
                    .buildFingerprint(build.buildFingerprint())
                    .securityPatch(build.securityPatch());
        } else {
            builder.unavailable(DeviceSnapshot.BUILD);
        }

        if (deviceId != null && serial != null && installId != null && build != null) {
            builder.identityHash(ContentHasher.hashIdentity(deviceId, serial, installId,
                    Objects.toString(build.manufacturer(), ""), Objects.toString(build.model(), "")));
        } else {
            builder.unavailable(DeviceSnapshot.IDENTITY_HASH);
        }

        SecurityPostureProbe.PostureAssessment posture =
                postureProbe.assess(properties, settings, packages, rootPaths);
        builder.rooted(posture.rooted())
                .bootloaderUnlocked(posture.bootloaderUnlocked())
                .customRom(posture.customRom())
                .usbDebugging(posture.usbDebugging())
                .developerMode(posture.developerMode());
        markIfMissing(builder, DeviceSnapshot.ROOTED, posture.rooted());
        markIfMissing(builder, DeviceSnapshot.BOOTLOADER_UNLOCKED, posture.bootloaderUnlocked());
        markIfMissing(builder, DeviceSnapshot.CUSTOM_ROM, posture.customRom());
        markIfMissing(builder, DeviceSnapshot.USB_DEBUGGING, posture.usbDebugging());
        markIfMissing(builder, DeviceSnapshot.DEVELOPER_MODE, posture.developerMode());

        if (packages != null) {
            builder.appInventoryHash(ContentHasher.hashInventory(packages));
        } else {
            builder.unavailable(DeviceSnapshot.APP_INVENTORY_HASH);
        }
        if (properties != null) {
            builder.systemPropertiesHash(ContentHasher.hashProperties(properties));
        } else {
            builder.unavailable(DeviceSnapshot.SYSTEM_PROPERTIES_HASH);
        }

        builder.batteryPercent(battery).uptimeMillis(uptime);
        markIfMissing(builder, DeviceSnapshot.BATTERY, battery);
        markIfMissing(builder, DeviceSnapshot.UPTIME, uptime);
        if (location != null) {
            builder.location(location.orElse(null));
        } else {
            builder.unavailable(DeviceSnapshot.LOCATION);
        }

        DeviceSnapshot snapshot = builder.build();
        if (!failedReads.isEmpty()) {
            log.warn("Partial snapshot: reads {} failed, unavailable fields {}",
                    failedReads, snapshot.unavailableFields());
        }
        return snapshot;
    }

    public Duration captureTimeout() {
        return captureTimeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ==================== Private Methods ====================

    private Set<String> presentRootPaths() throws Exception {
        Set<String> present = new TreeSet<>();
        for (String path : SecurityPostureProbe.ROOT_PATHS) {
            if (source.pathExists(path)) {
                present.add(path);
            }
        }
        return present;
    }

    private <T> T await(Future<T> read, long deadlineNanos, String label, Set<String> failedReads) {
        long remaining = deadlineNanos - System.nanoTime();
        try {
            if (remaining <= 0 && !read.isDone()) {
                throw new TimeoutException();
            }
            return read.get(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            read.cancel(true);
            log.debug("Read '{}' missed the capture deadline", label);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Read '{}' failed: {}", label, cause.toString());
        } catch (InterruptedException e) {
            read.cancel(true);
            Thread.currentThread().interrupt();
        }
        failedReads.add(label);
        return null;
    }

    private static void markIfMissing(DeviceSnapshot.Builder builder, String field, Object value) {
        if (value == null) {
            builder.unavailable(field);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
