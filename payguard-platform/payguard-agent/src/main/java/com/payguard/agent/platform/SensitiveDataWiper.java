package com.payguard.agent.platform;

/**
 * Clears locally cached sensitive data (credentials, tokens, cached documents).
 */
public interface SensitiveDataWiper {

    /**
     * @return number of items removed
     */
    int wipeSensitiveData() throws Exception;
}
