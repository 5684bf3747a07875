package com.payguard.agent.platform;

/**
 * Device-owner privileged operations. Implemented by the platform integration.
 *
 * Calls may block or throw; {@link PrivilegeGateway} bounds and reports them.
 */
public interface DevicePrivilegeController {

    void lockDevice() throws Exception;

    void releaseLock() throws Exception;

    void disableCamera(boolean disabled) throws Exception;

    void disableUSB(boolean disabled) throws Exception;

    void disableDeveloperOptions(boolean disabled) throws Exception;

    void restrictNetwork(boolean restricted) throws Exception;
}
