package com.payguard.agent.sync;

import java.io.IOException;

/**
 * HTTP transport to the backend. The platform integration supplies TLS, authentication
 * and the base URL.
 */
public interface BackendTransport {

    /**
     * Posts a JSON document.
     *
     * @param path path relative to the backend base URL
     * @throws IOException when the backend cannot be reached
     */
    TransportResponse post(String path, String jsonBody) throws IOException;
}
