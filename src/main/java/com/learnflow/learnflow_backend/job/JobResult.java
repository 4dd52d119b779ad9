package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Outcome of one content job. {@code failedConcepts} is the exact
 * (concept, content type) failure set, which is what a retry job regenerates.
 */
@Value
@Builder(toBuilder = true)
public class JobResult {

    String jobId;
    String runId;
    String roadmapId;
    ContentJobStatus status;
    boolean retry;

    @Builder.Default
    Map<String, Map<ContentType, String>> contentRefs = Map.of();

    @Builder.Default
    Map<String, Set<ContentType>> failedConcepts = Map.of();

    // "concept/type" -> failure reason
    @Builder.Default
    Map<String, String> unitErrors = Map.of();

    int totalUnits;
    int completedUnits;
    int failedUnits;
    int skippedUnits;
    int persistedBatches;
    boolean aborted;
    String stopReason;
    long durationMs;

    @Builder.Default
    Map<String, Object> allocationStats = Map.of();

    public boolean hasFailures() {
        return failedConcepts.values().stream().anyMatch(types -> !types.isEmpty());
    }

    public int failedConceptCount() {
        return (int) failedConcepts.values().stream().filter(types -> !types.isEmpty()).count();
    }

    public Map<String, List<String>> failureSummary() {
        Map<String, List<String>> summary = new TreeMap<>();
        failedConcepts.forEach((conceptId, types) -> {
            if (!types.isEmpty()) {
                summary.put(conceptId, types.stream().map(ContentType::wireName).sorted().toList());
            }
        });
        return summary;
    }

    public Map<String, Object> executionSummary() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("status", status.name());
        summary.put("totalUnits", totalUnits);
        summary.put("completedUnits", completedUnits);
        summary.put("failedUnits", failedUnits);
        summary.put("skippedUnits", skippedUnits);
        summary.put("persistedBatches", persistedBatches);
        summary.put("aborted", aborted);
        if (stopReason != null) summary.put("stopReason", stopReason);
        summary.put("durationMs", durationMs);
        summary.put("keyAllocation", allocationStats);
        return summary;
    }
}
