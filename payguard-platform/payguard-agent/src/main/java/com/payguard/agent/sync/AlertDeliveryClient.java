package com.payguard.agent.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payguard.agent.error.BoundedCall;
import com.payguard.agent.error.ErrorKind;
import com.payguard.agent.error.Result;
import com.payguard.agent.queue.AlertDispatcher;
import com.payguard.agent.queue.AlertSeverity;
import com.payguard.agent.queue.QueuedAlert;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Delivers queued alerts to the backend alert endpoint.
 */
public class AlertDeliveryClient implements AlertDispatcher {

    private final BackendTransport transport;
    private final ObjectMapper mapper;
    private final BoundedCall boundedCall;

    public AlertDeliveryClient(BackendTransport transport, ObjectMapper mapper, BoundedCall boundedCall) {
        this.transport = Objects.requireNonNull(transport, "Transport cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "Mapper cannot be null");
        this.boundedCall = Objects.requireNonNull(boundedCall, "Bounded call cannot be null");
    }

    @Override
    public Result<Void> deliver(QueuedAlert alert) {
        AlertPayload payload = new AlertPayload(
                alert.alertId(),
                alert.deviceId(),
                alert.attemptNumber(),
                alert.severity(),
                alert.escalationLevel(),
                alert.deviceLocked(),
                alert.flags(),
                alert.occurredAt()
        );

        String body;
        try {
            body = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return Result.failure(ErrorKind.INVALID_STATE, "Cannot serialize alert: " + e.getOriginalMessage());
        }

        String path = "/api/devices/" + alert.deviceId() + "/alerts/";
        Result<TransportResponse> sent = boundedCall.call(ErrorKind.NETWORK_FAILURE, "POST " + path,
                () -> transport.post(path, body));
        if (sent.isFailure()) {
            return sent.asFailure();
        }
        TransportResponse response = sent.value();
        if (response == null || !response.successful()) {
            return Result.failure(ErrorKind.NETWORK_FAILURE,
                    "Alert rejected with status " + (response != null ? response.statusCode() : -1));
        }
        return Result.ok();
    }

    /**
     * Wire form of a removal or tamper alert.
     */
    public record AlertPayload(
            String alertId,
            String deviceId,
            long attemptNumber,
            AlertSeverity severity,
            int escalationLevel,
            boolean deviceLocked,
            List<String> flags,
            Instant timestamp
    ) {}
}
