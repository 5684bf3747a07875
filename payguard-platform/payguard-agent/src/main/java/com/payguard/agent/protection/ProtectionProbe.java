package com.payguard.agent.protection;

/**
 * Platform checks of the agent's own protection.
 */
public interface ProtectionProbe {

    boolean appInstalled() throws Exception;

    boolean deviceOwnerEnabled() throws Exception;

    boolean uninstallBlocked() throws Exception;

    boolean forceStopBlocked() throws Exception;

    /**
     * Whether the platform-side encrypted status record decrypts and matches.
     */
    boolean statusIntegrityValid() throws Exception;
}
