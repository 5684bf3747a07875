package com.payguard.agent.sync;

import com.payguard.agent.command.BackendCommand;
import com.payguard.agent.lock.LockType;
import com.payguard.agent.snapshot.DeviceSnapshot;

/**
 * Heartbeat response. Every part except {@code success} is optional.
 *
 * @param verifiedSnapshot snapshot the backend accepts as the new baseline
 * @param clearance the backend cleared the device's tamper escalation
 * @param unlockPin offline unlock PIN to provision
 */
public record BackendResponse(
        boolean success,
        DeviceSnapshot verifiedSnapshot,
        LockStatusView lockStatus,
        BackendCommand command,
        Boolean clearance,
        String unlockPin
) {
    public boolean clearanceGranted() {
        return Boolean.TRUE.equals(clearance);
    }

    /**
     * Backend view of the lock.
     */
    public record LockStatusView(
            boolean locked,
            LockType lockType,
            String reason
    ) {}
}
