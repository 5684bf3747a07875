package com.payguard.agent.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payguard.agent.error.PersistenceException;

import java.util.Objects;
import java.util.Optional;

/**
 * Typed access to the {@link StateStore}. Values are stored as JSON documents.
 *
 * All state (baselines, escalation, locks, alert queue, incident counters, executed commands)
 * goes through this class, keyed by device identifier.
 */
public class StateRepository {

    private final StateStore store;
    private final ObjectMapper mapper;

    public StateRepository(StateStore store) {
        this(store, createObjectMapper());
    }

    public StateRepository(StateStore store, ObjectMapper mapper) {
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "Mapper cannot be null");
    }

    public <T> Optional<T> read(String key, Class<T> type) {
        return store.get(key).map(json -> {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new PersistenceException("Corrupt state document '" + key + "'", e);
            }
        });
    }

    public <T> Optional<T> read(String key, TypeReference<T> type) {
        return store.get(key).map(json -> {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new PersistenceException("Corrupt state document '" + key + "'", e);
            }
        });
    }

    public void write(String key, Object value) {
        Objects.requireNonNull(value, "Value cannot be null");
        String json;
        try {
            json = mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize state '" + key + "'", e);
        }
        store.put(key, json);
    }

    public void delete(String key) {
        store.remove(key);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Builds the mapper used for persisted state and backend payloads.
     * ISO-8601 timestamps, unknown properties tolerated for forward compatibility.
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
