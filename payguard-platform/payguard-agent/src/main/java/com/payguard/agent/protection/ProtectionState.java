package com.payguard.agent.protection;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of a protection self-check.
 *
 * @param degradedReasons why the last cycle or this check could not complete cleanly
 */
public record ProtectionState(
        boolean appInstalled,
        boolean deviceOwnerEnabled,
        boolean uninstallBlocked,
        boolean forceStopBlocked,
        boolean statusIntegrityValid,
        List<String> degradedReasons,
        Instant checkedAt
) {
    public ProtectionState {
        degradedReasons = degradedReasons != null ? List.copyOf(degradedReasons) : List.of();
    }

    public boolean healthy() {
        return appInstalled && deviceOwnerEnabled && uninstallBlocked && forceStopBlocked
                && statusIntegrityValid && degradedReasons.isEmpty();
    }
}
