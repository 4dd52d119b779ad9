package com.learnflow.learnflow_backend.model.workflow;

public enum EditSource {
    VALIDATION_FAILED,
    HUMAN_REVIEW
}
