package com.learnflow.learnflow_backend.model.workflow;

/**
 * External review verdict injected on resume as the human_review stage's result.
 */
public record HumanDecision(boolean approved, String feedback) {

    public static HumanDecision approve() {
        return new HumanDecision(true, null);
    }

    public static HumanDecision reject(String feedback) {
        return new HumanDecision(false, feedback);
    }
}
