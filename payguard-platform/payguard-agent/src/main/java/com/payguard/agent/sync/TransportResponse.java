package com.payguard.agent.sync;

public record TransportResponse(
        int statusCode,
        String body
) {
    public boolean successful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
