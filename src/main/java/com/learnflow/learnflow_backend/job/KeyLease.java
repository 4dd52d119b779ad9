package com.learnflow.learnflow_backend.job;

/**
 * Read-only view of one pooled credential as of the allocation read.
 */
public record KeyLease(String apiKey, int remainingQuota) {

    /** First six characters; the only form a key may take in logs. */
    public String redacted() {
        return apiKey == null ? "null" : apiKey.substring(0, Math.min(6, apiKey.length())) + "...";
    }
}
