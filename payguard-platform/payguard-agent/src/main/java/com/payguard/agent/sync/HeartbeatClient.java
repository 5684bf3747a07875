package com.payguard.agent.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Sends heartbeats and parses the backend's answer.
 *
 * Unreachable backend, timeouts, non-2xx answers and unreadable bodies are all reported
 * as {@link ErrorKind#NETWORK_FAILURE}; none of them is thrown.
 */
public class HeartbeatClient {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatClient.class);

    private final BackendTransport transport;
    private final ObjectMapper mapper;
    private final BoundedCall boundedCall;

    public HeartbeatClient(BackendTransport transport, ObjectMapper mapper, BoundedCall boundedCall) {
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "Mapper cannot be null");
        this.boundedCall = Objects.requireNonNull(boundedCall, "Bounded call cannot be null");
    }

    public Result<BackendResponse> sync(SyncPayload payload) {
        Objects.requireNonNull(payload, "Payload cannot be null");

        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return Result.failure(ErrorKind.INVALID_STATE, "Cannot serialize heartbeat: " + e.getOriginalMessage());
        }

        String path = "/api/devices/" + payload.deviceId() + "/heartbeat/";
        Result<TransportResponse> sent = boundedCall.call(ErrorKind.NETWORK_FAILURE, "POST " + path,
                () -> transport.post(path, body));
        if (sent.isFailure()) {
            log.debug("Heartbeat for {} not delivered: {}", payload.deviceId(), sent.message());
            return sent.asFailure();
        }

        TransportResponse response = sent.value();
        if (response == null || !response.successful()) {
            int status = response != null ? response.statusCode() : -1;
            return Result.failure(ErrorKind.NETWORK_FAILURE, "Heartbeat rejected with status " + status);
        }
        if (response.body() == null || response.body().isBlank()) {
            return Result.ok(new BackendResponse(true, null, null, null, null, null));
        }

        try {
            return Result.ok(mapper.readValue(response.body(), BackendResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable heartbeat response for {}: {}", payload.deviceId(), e.getOriginalMessage());
            return Result.failure(ErrorKind.NETWORK_FAILURE, "Unreadable heartbeat response");
        }
    }
}
