package com.payguard.agent.kernel;

import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.escalation.MonitoringCadence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one verification cycle per device at a time. The next cycle is scheduled only after
 * the previous one finished, with the interval the device's cadence currently asks for.
 */
public class PollScheduler {

    private static final Logger log = LoggerFactory.getLogger(PollScheduler.class);

    private final MonitoringCadence cadence;
    private final int poolSize;
    private final Map<String, ScheduledFuture<?>> scheduled;
    private final AtomicBoolean running;
    private volatile ScheduledExecutorService executor;

    public PollScheduler(MonitoringCadence cadence, int poolSize) {
        this.cadence = Objects.requireNonNull(cadence, "Cadence cannot be null");
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be positive");
        }
        this.poolSize = poolSize;
        this.scheduled = new ConcurrentHashMap<>();
        this.running = new AtomicBoolean(false);
    }

    /**
     * Starts the scheduler. A stopped scheduler can be started again.
     */
    public synchronized void start() {
        if (running.get()) {
            return;
        }
        ScheduledThreadPoolExecutor pool =
                new ScheduledThreadPoolExecutor(poolSize, BoundedCall.daemonThreads("payguard-poll"));
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor = pool;
        running.set(true);
    }

    /**
     * Schedules the device's cycle to run now and then repeatedly.
     *
     * @throws IllegalStateException if the scheduler is not running
     */
    public void schedule(String deviceId, Runnable cycle) {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        Objects.requireNonNull(cycle, "Cycle cannot be null");
        if (!running.get()) {
            throw new IllegalStateException("Scheduler not running");
        }
        ScheduledFuture<?> previous = scheduled.get(deviceId);
        if (previous != null) {
            previous.cancel(false);
        }
        scheduleNext(deviceId, cycle, Duration.ZERO);
    }

    /**
     * Stops scheduling new cycles. A cycle already running is allowed to finish within the grace period.
     */
    public synchronized void stop(Duration grace) {
        if (!running.getAndSet(false)) {
            return;
        }
        scheduled.values().forEach(future -> future.cancel(false));
        scheduled.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Poll cycle still running after {} ms grace period", grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for poll cycles to finish");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public int getScheduledCount() {
        return scheduled.size();
    }

    private void scheduleNext(String deviceId, Runnable cycle, Duration delay) {
        if (!running.get()) {
            return;
        }
        try {
            ScheduledFuture<?> future = executor.schedule(
                    () -> runAndReschedule(deviceId, cycle), delay.toMillis(), TimeUnit.MILLISECONDS);
            scheduled.put(deviceId, future);
            if (!running.get()) {
                future.cancel(false);
                scheduled.remove(deviceId);
            }
        } catch (RejectedExecutionException e) {
            log.debug("Not rescheduling {}: scheduler is shutting down", deviceId);
        }
    }

    private void runAndReschedule(String deviceId, Runnable cycle) {
        if (!running.get()) {
            return;
        }
        try {
            cycle.run();
        } catch (RuntimeException e) {
            log.error("Poll cycle for {} failed", deviceId, e);
        } finally {
            scheduleNext(deviceId, cycle, cadence.intervalFor(deviceId));
        }
    }
}
