package com.payguard.agent.kernel;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.baseline.BaselineStore;
import com.payguard.agent.kernel.event.AgentEvent;
import com.payguard.agent.kernel.event.AgentEventType;
import com.payguard.agent.kernel.event.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Agent runtime kernel: boot, polling lifecycle and event wiring.
 *
 * Boot sequence: verify audit chain → make sure every device has an active baseline
 * → start polling. A broken audit chain is reported but does not block protection.
 */
public class AgentKernel {

    private static final Logger log = LoggerFactory.getLogger(AgentKernel.class);

    private final String agentId;
    private final List<String> deviceIds;
    private final AtomicReference<KernelState> state;
    private final EventBus eventBus;
    private final PollScheduler pollScheduler;
    private final ProtectionEngine engine;
    private final BaselineStore baselineStore;
    private final AuditLog auditLog;
    private final boolean autoEnroll;
    private final Duration shutdownGrace;
    private final Clock clock;

    private volatile Instant bootTime;

    /**
     * Creates a new AgentKernel instance.
     *
     * @param agentId identifier of this agent installation
     * @param deviceIds devices this agent protects
     * @param autoEnroll enroll a device on boot when it has no baseline at all
     * @param shutdownGrace how long stop waits for a running cycle
     */
    public AgentKernel(
            String agentId,
            List<String> deviceIds,
            EventBus eventBus,
            PollScheduler pollScheduler,
            ProtectionEngine engine,
            BaselineStore baselineStore,
            AuditLog auditLog,
            boolean autoEnroll,
            Duration shutdownGrace,
            Clock clock) {

        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("Agent ID cannot be null or blank");
        }
        if (deviceIds == null || deviceIds.isEmpty()) {
            throw new IllegalArgumentException("At least one device ID is required");
        }

        this.agentId = agentId;
        this.deviceIds = List.copyOf(deviceIds);
        this.state = new AtomicReference<>(KernelState.CREATED);
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.pollScheduler = Objects.requireNonNull(pollScheduler, "Poll scheduler cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.baselineStore = Objects.requireNonNull(baselineStore, "Baseline store cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.autoEnroll = autoEnroll;
        this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "Shutdown grace cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Executes the boot sequence and starts polling.
     *
     * @return future completing when polling has started; fails with KernelException if boot fails
     */
    public CompletableFuture<BootResult> start() {
        if (state.get() == KernelState.RUNNING) {
            return CompletableFuture.completedFuture(
                    new BootResult(true, "Kernel already running", bootTime));
        }

        if (!state.compareAndSet(KernelState.CREATED, KernelState.BOOTING) &&
            !state.compareAndSet(KernelState.STOPPED, KernelState.BOOTING)) {
            return CompletableFuture.failedFuture(
                    new KernelException("Cannot start kernel from state: " + state.get()));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                emit(new AgentEvent(AgentEventType.BOOT_STARTED, agentId, clock.instant()));

                AuditLog.VerificationResult chain = auditLog.verifyIntegrity();
                if (!chain.valid()) {
                    log.warn("Audit chain verification failed: {}", chain.errors());
                }
                emit(new AgentEvent(AgentEventType.STATE_VERIFIED, agentId, clock.instant(),
                        chain.valid() ? "Audit chain intact" : "Audit chain broken"));

                for (String deviceId : deviceIds) {
                    ensureBaseline(deviceId);
                }
                emit(new AgentEvent(AgentEventType.BASELINE_READY, agentId, clock.instant()));

                pollScheduler.start();
                for (String deviceId : deviceIds) {
                    pollScheduler.schedule(deviceId, () -> engine.runCycle(deviceId));
                }
                emit(new AgentEvent(AgentEventType.POLLING_STARTED, agentId, clock.instant()));

                bootTime = clock.instant();
                state.set(KernelState.RUNNING);
                emit(new AgentEvent(AgentEventType.BOOT_COMPLETE, agentId, bootTime));
                log.info("Agent {} protecting {} device(s)", agentId, deviceIds.size());

                return new BootResult(true, "Boot sequence completed successfully", bootTime);

            } catch (Exception e) {
                state.set(KernelState.FAILED);
                emit(new AgentEvent(AgentEventType.BOOT_FAILED, agentId, clock.instant(), e.getMessage()));
                throw new KernelException("Boot sequence failed: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Stops polling. A cycle in progress finishes first.
     */
    public CompletableFuture<Void> stop() {
        if (!state.compareAndSet(KernelState.RUNNING, KernelState.STOPPING)) {
            return CompletableFuture.completedFuture(null);
        }
        emit(new AgentEvent(AgentEventType.SHUTDOWN_STARTED, agentId, clock.instant()));

        return CompletableFuture.runAsync(() -> {
            try {
                pollScheduler.stop(shutdownGrace);
                state.set(KernelState.STOPPED);
                emit(new AgentEvent(AgentEventType.SHUTDOWN_COMPLETE, agentId, clock.instant()));
            } catch (Exception e) {
                state.set(KernelState.FAILED);
                throw new KernelException("Shutdown failed: " + e.getMessage(), e);
            }
        });
    }

    public void emit(AgentEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        eventBus.emit(event);
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @return subscription ID for {@link #off(String)}
     */
    public String on(AgentEventType eventType, Consumer<AgentEvent> handler) {
        if (eventType == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler cannot be null");
        }
        return eventBus.subscribe(eventType, handler);
    }

    public void off(String subscriptionId) {
        eventBus.unsubscribe(subscriptionId);
    }

    public KernelState getState() {
        return state.get();
    }

    public String getAgentId() {
        return agentId;
    }

    public List<String> getDeviceIds() {
        return deviceIds;
    }

    public Instant getBootTime() {
        return bootTime;
    }

    public boolean isRunning() {
        return state.get() == KernelState.RUNNING;
    }

    public ProtectionEngine getEngine() {
        return engine;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    private void ensureBaseline(String deviceId) {
        if (baselineStore.active(deviceId).isPresent()) {
            return;
        }
        if (baselineStore.enrollment(deviceId).isPresent()) {
            engine.recoverBaseline(deviceId);
            log.info("Recovered baseline for {} from enrollment", deviceId);
        } else if (autoEnroll) {
            engine.enroll(deviceId);
            log.info("Enrolled {} on boot", deviceId);
        } else {
            log.warn("Device {} has no baseline; verification stays inconclusive until enrollment", deviceId);
        }
    }

    // ==================== Inner Types ====================

    /**
     * Kernel lifecycle states.
     */
    public enum KernelState {
        CREATED,
        BOOTING,
        RUNNING,
        STOPPING,
        STOPPED,
        FAILED
    }

    public record BootResult(
            boolean success,
            String message,
            Instant bootTime
    ) {}

    public static class KernelException extends RuntimeException {
        public KernelException(String message) {
            super(message);
        }

        public KernelException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
