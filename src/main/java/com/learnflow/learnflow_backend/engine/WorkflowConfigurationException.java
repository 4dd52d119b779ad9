package com.learnflow.learnflow_backend.engine;

/**
 * Fatal wiring error: an unmapped routing pair, a stage without an executor,
 * or a run that exceeded the stage execution cap. Never retried.
 */
public class WorkflowConfigurationException extends RuntimeException {

    public WorkflowConfigurationException(String message) {
        super(message);
    }
}
