package com.learnflow.learnflow_backend.job;

/**
 * A task handed to a worker: the broker handle plus its decoded payload.
 */
public record BrokerTask(String handle, ContentJobPayload payload) {
}
