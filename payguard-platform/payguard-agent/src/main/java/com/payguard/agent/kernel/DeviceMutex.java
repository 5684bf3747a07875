package com.payguard.agent.kernel;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per device. Escalation, lock application and command execution for a device
 * run under it, so the poll path and the notification path never interleave.
 */
public class DeviceMutex {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String deviceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(deviceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(String deviceId, Runnable action) {
        withLock(deviceId, () -> {
            action.run();
            return null;
        });
    }
}
