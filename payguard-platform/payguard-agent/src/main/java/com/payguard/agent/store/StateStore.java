package com.payguard.agent.store;

import com.payguard.agent.error.PersistenceException;

import java.util.Optional;

/**
 * Durable key-value storage for agent state.
 * Values are opaque serialized documents; every write must be durable when the call returns.
 *
 * Implementations throw {@link PersistenceException} when the backing store is unavailable.
 */
public interface StateStore {

    /**
     * Reads a stored document.
     */
    Optional<String> get(String key);

    /**
     * Writes a document, replacing any previous value atomically.
     */
    void put(String key, String value);

    /**
     * Removes a document. Removing a missing key is not an error.
     */
    void remove(String key);
}
