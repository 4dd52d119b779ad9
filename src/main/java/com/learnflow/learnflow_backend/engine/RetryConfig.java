package com.learnflow.learnflow_backend.engine;

import lombok.Data;

/**
 * Backoff settings for transient infrastructure retries.
 *
 * <pre>
 * learnflow:
 *   retry:
 *     max-retries: 3
 *     backoff-ms: 200
 *     backoff-multiplier: 2.0
 * </pre>
 */
@Data
public class RetryConfig {

    /**
     * How many times to retry after the initial attempt.
     * 0 means no retry. Values are clamped to [0, 10].
     */
    private int maxRetries = 3;

    /**
     * Delay in milliseconds before the first retry attempt.
     */
    private long backoffMs = 200L;

    /**
     * Multiplier applied to the delay after each failed attempt.
     * e.g. 200ms with 2.0 → 200ms, 400ms, 800ms...
     */
    private double backoffMultiplier = 2.0d;

    public static RetryConfig of(int maxRetries, long backoffMs, double backoffMultiplier) {
        RetryConfig config = new RetryConfig();
        config.setMaxRetries(maxRetries);
        config.setBackoffMs(backoffMs);
        config.setBackoffMultiplier(backoffMultiplier);
        return config;
    }
}
