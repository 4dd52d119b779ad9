package com.learnflow.learnflow_backend.model.workflow;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Per-run routing and fan-out settings. Captured once at run start and carried
 * inside the checkpointed state, so a resumed run keeps the config it started with.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class WorkflowConfig {

    @Builder.Default
    boolean skipValidation = false;

    @Builder.Default
    boolean skipHumanReview = false;

    @Builder.Default
    boolean skipContentGeneration = false;

    @Builder.Default
    int maxValidationRetries = 3;

    @Builder.Default
    int contentConcurrencyLimit = 30;

    public static WorkflowConfig defaults() {
        return WorkflowConfig.builder().build();
    }
}
