package com.learnflow.learnflow_backend.service;

import com.learnflow.learnflow_backend.model.workflow.RunStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What a status query returns. {@code live} is true when the answer came from
 * the in-process stage tracker rather than the stored run.
 */
public record RunStatusView(String runId,
                            RunStatus status,
                            String stage,
                            String roadmapId,
                            String contentJobId,
                            String errorMessage,
                            Map<String, List<String>> failedConcepts,
                            boolean live,
                            Instant updatedAt) {
}
