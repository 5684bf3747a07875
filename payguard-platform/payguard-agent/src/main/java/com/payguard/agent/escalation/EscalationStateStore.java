package com.payguard.agent.escalation;

import com.payguard.agent.store.StateRepository;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable escalation state per device, shared by the state machine (writer) and
 * lock evaluation (reader). Writes are persisted before the cached copy changes.
 */
public class EscalationStateStore {

    private static final String KEY = "escalation.";

    private final StateRepository repository;
    private final Map<String, EscalationState> cache = new ConcurrentHashMap<>();

    public EscalationStateStore(StateRepository repository) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
    }

    public EscalationState load(String deviceId) {
        Objects.requireNonNull(deviceId, "Device ID cannot be null");
        EscalationState cached = cache.get(deviceId);
        if (cached != null) {
            return cached;
        }
        EscalationState state = repository.read(KEY + deviceId, EscalationState.class)
                .orElseGet(() -> EscalationState.initial(deviceId));
        cache.put(deviceId, state);
        return state;
    }

    public void save(EscalationState state) {
        Objects.requireNonNull(state, "State cannot be null");
        repository.write(KEY + state.deviceId(), state);
        cache.put(state.deviceId(), state);
    }
}
