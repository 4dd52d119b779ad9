package com.learnflow.learnflow_backend.model.workflow;

/**
 * Why a run is parked. A parked run holds no resources; it continues only
 * through a fresh resume call that loads the latest checkpoint.
 */
public enum AwaitReason {
    HUMAN_REVIEW,
    CONTENT_JOB
}
