package com.payguard.agent.lock;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted lock state of one device.
 *
 * @param active the lock currently in force, or null
 * @param acknowledgedDemand demand whose lock was explicitly released; it does not re-lock
 *                           the device until the demand changes or disappears
 * @param history released locks, newest last
 */
public record LockLedger(
        LockRecord active,
        LockDemand acknowledgedDemand,
        List<LockRecord> history
) {
    static final int MAX_HISTORY = 20;

    public LockLedger {
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static LockLedger empty() {
        return new LockLedger(null, null, List.of());
    }

    LockLedger withActive(LockRecord record) {
        return new LockLedger(record, acknowledgedDemand, history);
    }

    LockLedger withAcknowledged(LockDemand demand) {
        return new LockLedger(active, demand, history);
    }

    /**
     * Moves a released record into history and clears the active slot.
     */
    LockLedger retire(LockRecord released, LockDemand acknowledge) {
        List<LockRecord> updated = new ArrayList<>(history);
        updated.add(released);
        while (updated.size() > MAX_HISTORY) {
            updated.remove(0);
        }
        return new LockLedger(null, acknowledge, updated);
    }
}
