package com.learnflow.learnflow_backend.model.workflow;

public class InvalidStateDeltaException extends RuntimeException {

    public InvalidStateDeltaException(String message) {
        super(message);
    }
}
