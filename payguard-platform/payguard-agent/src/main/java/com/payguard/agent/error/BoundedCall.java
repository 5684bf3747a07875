package com.payguard.agent.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a potentially blocking collaborator call with a per-call timeout.
 * Timeouts and exceptions are mapped to a failed {@link Result} of the caller's kind,
 * so the polling loop never waits on a stuck platform or network call.
 */
public class BoundedCall implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedCall.class);

    private final ExecutorService executor;
    private final Duration timeout;

    public BoundedCall(Duration timeout) {
        this(Executors.newCachedThreadPool(daemonThreads("bounded-call")), timeout);
    }

    public BoundedCall(ExecutorService executor, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
    }

    /**
     * Executes the action and returns its value, or a failure of the given kind.
     */
    public <T> Result<T> call(ErrorKind kind, String description, Callable<T> action) {
        Future<T> future;
        try {
            future = executor.submit(action);
        } catch (RuntimeException e) {
            return Result.failure(kind, description + " could not be scheduled: " + e.getMessage());
        }

        try {
            return Result.ok(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {} ms", description, timeout.toMillis());
            return Result.failure(kind, description + " timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return Result.failure(kind, description + " failed: " + describe(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Result.failure(kind, description + " interrupted");
        }
    }

    /**
     * Executes an action without a return value.
     */
    public Result<Void> run(ErrorKind kind, String description, Action action) {
        return call(kind, description, () -> {
            action.run();
            return null;
        });
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    /**
     * Creates a thread factory for daemon worker threads with a readable prefix.
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * A blocking action that may throw.
     */
    @FunctionalInterface
    public interface Action {
        void run() throws Exception;
    }
}
