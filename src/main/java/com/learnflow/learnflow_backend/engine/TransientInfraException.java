package com.learnflow.learnflow_backend.engine;

/**
 * Broker or storage hiccup that is safe to retry with backoff.
 */
public class TransientInfraException extends RuntimeException {

    public TransientInfraException(String message) {
        super(message);
    }

    public TransientInfraException(String message, Throwable cause) {
        super(message, cause);
    }
}
