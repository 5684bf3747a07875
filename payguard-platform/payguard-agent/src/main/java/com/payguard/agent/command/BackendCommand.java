package com.payguard.agent.command;

import java.time.Instant;
import java.util.Map;

/**
 * A command delivered in a heartbeat response. Executed at most once per {@code commandId}.
 *
 * @param parameters optional arguments, e.g. {@code lockType} for LOCK_DEVICE
 */
public record BackendCommand(
        String commandId,
        CommandType type,
        Map<String, String> parameters,
        Instant issuedAt
) {
    public BackendCommand {
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public String parameter(String name, String defaultValue) {
        return parameters.getOrDefault(name, defaultValue);
    }
}
