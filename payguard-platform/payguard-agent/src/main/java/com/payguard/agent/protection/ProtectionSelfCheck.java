package com.payguard.agent.protection;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import com.payguard.agent.store.StateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Verifies that the agent is still installed, device owner, and shielded from uninstall
 * and force-stop, and that the audit chain is intact.
 *
 * Only pass or fail and the time of the check are persisted.
 */
public class ProtectionSelfCheck {

    private static final Logger log = LoggerFactory.getLogger(ProtectionSelfCheck.class);
    private static final String KEY = "protection.check.";

    private final ProtectionProbe probe;
    private final AuditLog auditLog;
    private final StateRepository repository;
    private final BoundedCall boundedCall;
    private final Clock clock;

    public ProtectionSelfCheck(ProtectionProbe probe, AuditLog auditLog, StateRepository repository,
                               BoundedCall boundedCall, Clock clock) {
        this.probe = Objects.requireNonNull(probe, "Probe cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.boundedCall = Objects.requireNonNull(boundedCall, "Bounded call cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    /**
     * Runs the check.
     *
     * @param cycleDegradedReasons problems already seen by the current cycle
     */
    public ProtectionState check(String deviceId, List<String> cycleDegradedReasons) {
        List<String> reasons = new ArrayList<>(cycleDegradedReasons != null ? cycleDegradedReasons : List.of());

        boolean installed = runCheck("appInstalled", probe::appInstalled, reasons);
        boolean deviceOwner = runCheck("deviceOwnerEnabled", probe::deviceOwnerEnabled, reasons);
        boolean uninstallBlocked = runCheck("uninstallBlocked", probe::uninstallBlocked, reasons);
        boolean forceStopBlocked = runCheck("forceStopBlocked", probe::forceStopBlocked, reasons);
        boolean statusValid = runCheck("statusIntegrityValid", probe::statusIntegrityValid, reasons);

        AuditLog.VerificationResult chain = auditLog.verifyIntegrity();
        if (!chain.valid()) {
            reasons.add("audit chain: " + String.join("; ", chain.errors()));
        }

        Instant now = clock.instant();
        ProtectionState state = new ProtectionState(installed, deviceOwner, uninstallBlocked, forceStopBlocked,
                statusValid && chain.valid(), reasons, now);

        try {
            repository.write(KEY + deviceId, new CheckOutcome(state.healthy(), now));
        } catch (RuntimeException e) {
            log.warn("Could not persist protection check for {}: {}", deviceId, e.getMessage());
            reasons.add("persistence: " + e.getMessage());
            state = new ProtectionState(installed, deviceOwner, uninstallBlocked, forceStopBlocked,
                    statusValid && chain.valid(), reasons, now);
        }

        if (!state.healthy()) {
            log.warn("Protection degraded on {}: {}", deviceId, state);
            auditLog.record(AuditLog.EventType.PROTECTION_CHECK, AuditLog.Severity.HIGH,
                    "Protection self-check failed",
                    Map.of("deviceId", deviceId, "reasons", String.join("; ", state.degradedReasons())));
        }
        return state;
    }

    public Optional<CheckOutcome> lastOutcome(String deviceId) {
        return repository.read(KEY + deviceId, CheckOutcome.class);
    }

    private boolean runCheck(String name, Callable<Boolean> check, List<String> reasons) {
        Result<Boolean> result = boundedCall.call(ErrorKind.PRIVILEGE_ACTION_FAILURE, name, check);
        if (result.isFailure()) {
            reasons.add(result.message());
            return false;
        }
        boolean passed = Boolean.TRUE.equals(result.value());
        if (!passed) {
            reasons.add(name + " check failed");
        }
        return passed;
    }

    public record CheckOutcome(
            boolean passed,
            Instant checkedAt
    ) {}
}
