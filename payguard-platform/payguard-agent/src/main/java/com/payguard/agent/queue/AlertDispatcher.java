package com.payguard.agent.queue;

import com.payguard.agent.error.Result;

/**
 * Sends one alert to the backend.
 */
@FunctionalInterface
public interface AlertDispatcher {

    Result<Void> deliver(QueuedAlert alert);
}
