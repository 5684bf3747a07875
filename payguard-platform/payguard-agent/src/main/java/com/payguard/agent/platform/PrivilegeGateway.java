package com.payguard.agent.platform;

import com.payguard.agent.audit.AuditLog;
import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Single entry point for privileged platform calls.
 *
 * Each call runs under the configured per-call timeout. Failures come back as
 * {@link ErrorKind#PRIVILEGE_ACTION_FAILURE} results and are audited; nothing is thrown,
 * so a failing step never aborts the steps after it.
 */
public class PrivilegeGateway {

    private static final Logger log = LoggerFactory.getLogger(PrivilegeGateway.class);

    private final DevicePrivilegeController controller;
    private final SensitiveDataWiper wiper;
    private final BoundedCall boundedCall;
    private final AuditLog auditLog;

    public PrivilegeGateway(DevicePrivilegeController controller, SensitiveDataWiper wiper,
                            BoundedCall boundedCall, AuditLog auditLog) {
        this.controller = Objects.requireNonNull(controller, "Controller cannot be null");
        this.wiper = Objects.requireNonNull(wiper, "Wiper cannot be null");
        this.boundedCall = Objects.requireNonNull(boundedCall, "Bounded call cannot be null");
        this.auditLog = Objects.requireNonNull(auditLog, "Audit log cannot be null");
    }

    public Result<Void> lockDevice() {
        return run("lockDevice", controller::lockDevice);
    }

    public Result<Void> releaseLock() {
        return run("releaseLock", controller::releaseLock);
    }

    public Result<Void> setCameraDisabled(boolean disabled) {
        return run("disableCamera(" + disabled + ")", () -> controller.disableCamera(disabled));
    }

    public Result<Void> setUsbDisabled(boolean disabled) {
        return run("disableUSB(" + disabled + ")", () -> controller.disableUSB(disabled));
    }

    public Result<Void> setDeveloperOptionsDisabled(boolean disabled) {
        return run("disableDeveloperOptions(" + disabled + ")", () -> controller.disableDeveloperOptions(disabled));
    }

    public Result<Void> setNetworkRestricted(boolean restricted) {
        return run("restrictNetwork(" + restricted + ")", () -> controller.restrictNetwork(restricted));
    }

    public Result<Integer> wipeSensitiveData() {
        Result<Integer> result = boundedCall.call(ErrorKind.PRIVILEGE_ACTION_FAILURE, "wipeSensitiveData",
                wiper::wipeSensitiveData);
        if (result.isFailure()) {
            report("wipeSensitiveData", result.message());
        }
        return result;
    }

    private Result<Void> run(String action, BoundedCall.Action call) {
        Result<Void> result = boundedCall.run(ErrorKind.PRIVILEGE_ACTION_FAILURE, action, call);
        if (result.isFailure()) {
            report(action, result.message());
        }
        return result;
    }

    private void report(String action, String message) {
        log.error("Privileged action {} failed: {}", action, message);
        auditLog.logPrivilegeFailure(action, message);
    }
}
