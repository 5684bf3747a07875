package com.payguard.agent.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of StateStore.
 * For testing and development purposes only; nothing survives a process restart.
 */
public class InMemoryStateStore implements StateStore {

    private final Map<String, String> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        return Optional.ofNullable(documents.get(key));
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "Key cannot be null");
        Objects.requireNonNull(value, "Value cannot be null");
        documents.put(key, value);
    }

    @Override
    public void remove(String key) {
        Objects.requireNonNull(key, "Key cannot be null");
        documents.remove(key);
    }

    /**
     * Gets the number of stored documents (for testing).
     */
    public int size() {
        return documents.size();
    }

    /**
     * Clears all documents (for testing).
     */
    public void clear() {
        documents.clear();
    }
}
