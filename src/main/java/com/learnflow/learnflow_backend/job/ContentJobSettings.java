package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.model.roadmap.ContentType;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of the content job. Threshold and batch size were tuned
 * empirically, so they stay configuration.
 */
public record ContentJobSettings(int concurrencyLimit,
                                 int batchSize,
                                 double failureThreshold,
                                 Duration unitTimeout,
                                 int minQuota,
                                 List<ContentType> enabledTypes) {

    public static ContentJobSettings defaults() {
        return new ContentJobSettings(30, 10, 0.5, Duration.ofMinutes(5), 4,
                List.of(ContentType.TUTORIAL, ContentType.RESOURCE, ContentType.QUIZ));
    }
}
