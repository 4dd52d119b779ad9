package com.learnflow.learnflow_backend.model.roadmap;

public enum ContentUnitStatus {
    PENDING,
    GENERATING,
    COMPLETED,
    FAILED
}
