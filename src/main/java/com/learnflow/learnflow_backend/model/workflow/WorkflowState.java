package com.learnflow.learnflow_backend.model.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.IntentAnalysis;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.UserRequest;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Whole state of one run. Serialised into every checkpoint; optional fields are
 * filled in by the stage that owns them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowState {

    private String runId;
    private String traceId;
    private UserRequest userRequest;
    private WorkflowConfig config;

    private String roadmapId;
    private IntentAnalysis intentAnalysis;
    private RoadmapFramework framework;
    private ValidationResult validationResult;

    /** conceptId -> contentType -> stored content reference. */
    @Builder.Default
    private Map<String, Map<ContentType, String>> contentRefs = new TreeMap<>();

    /** conceptId -> content types that failed for it. */
    @Builder.Default
    private Map<String, Set<ContentType>> failedConcepts = new TreeMap<>();

    @Builder.Default
    private WorkflowStage currentStage = WorkflowStage.INIT;

    private int validationRetryCount;
    private boolean validationExhausted;
    private Boolean humanApproved;
    private String reviewFeedback;
    private EditSource editSource;

    private AwaitReason awaiting;
    private String contentJobId;

    @Builder.Default
    private List<String> executionHistory = new ArrayList<>();

    private Instant startedAt;
    private Instant updatedAt;

    public static WorkflowState initial(String runId, String traceId, UserRequest request, WorkflowConfig config) {
        Instant now = Instant.now();
        return WorkflowState.builder()
                .runId(runId)
                .traceId(traceId)
                .userRequest(request)
                .config(config)
                .startedAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean awaitingInput() {
        return awaiting != null;
    }

    public boolean hasFailures() {
        return failedConcepts.values().stream().anyMatch(types -> !types.isEmpty());
    }

    /**
     * Checks a delta against this state, then folds it in. Nothing is applied
     * when validation fails.
     */
    public void apply(StateDelta delta) {
        validate(delta);

        if (delta.getRoadmapId() != null) roadmapId = delta.getRoadmapId();
        if (delta.getIntentAnalysis() != null) intentAnalysis = delta.getIntentAnalysis();
        if (delta.getFramework() != null) framework = delta.getFramework();
        if (delta.getValidationResult() != null) validationResult = delta.getValidationResult();

        delta.getContentRefs().forEach((conceptId, refs) ->
                contentRefs.computeIfAbsent(conceptId, k -> new TreeMap<>()).putAll(refs));
        delta.getFailedConcepts().forEach((conceptId, types) -> {
            if (!types.isEmpty()) {
                failedConcepts.computeIfAbsent(conceptId, k -> EnumSet.noneOf(ContentType.class)).addAll(types);
            }
        });

        if (delta.getValidationRetryCount() != null) validationRetryCount = delta.getValidationRetryCount();
        if (delta.getValidationExhausted() != null) validationExhausted = delta.getValidationExhausted();
        if (delta.getHumanApproved() != null) humanApproved = delta.getHumanApproved();
        if (delta.getReviewFeedback() != null) reviewFeedback = delta.getReviewFeedback();
        if (delta.getEditSource() != null) editSource = delta.getEditSource();
        if (delta.getContentJobId() != null) contentJobId = delta.getContentJobId();

        if (delta.isClearAwaiting()) awaiting = null;
        if (delta.getAwaiting() != null) awaiting = delta.getAwaiting();

        if (delta.getHistoryEntry() != null) executionHistory.add(delta.getHistoryEntry());
        updatedAt = Instant.now();
    }

    private void validate(StateDelta delta) {
        if (delta.getRoadmapId() != null && roadmapId != null && !roadmapId.equals(delta.getRoadmapId())) {
            throw new InvalidStateDeltaException(
                    "roadmapId is already " + roadmapId + ", refusing to change it to " + delta.getRoadmapId());
        }
        if (delta.getValidationRetryCount() != null && delta.getValidationRetryCount() < validationRetryCount) {
            throw new InvalidStateDeltaException("validationRetryCount cannot decrease: "
                    + validationRetryCount + " -> " + delta.getValidationRetryCount());
        }
        if (delta.getAwaiting() != null && delta.isClearAwaiting()) {
            throw new InvalidStateDeltaException("A delta cannot both set and clear the await reason");
        }
        RoadmapFramework target = delta.getFramework() != null ? delta.getFramework() : framework;
        if (!delta.getContentRefs().isEmpty() || !delta.getFailedConcepts().isEmpty()) {
            if (target == null) {
                throw new InvalidStateDeltaException("Content results arrived before a framework exists");
            }
            for (String conceptId : unionKeys(delta)) {
                if (!target.containsConcept(conceptId)) {
                    throw new InvalidStateDeltaException("Unknown concept in content results: " + conceptId);
                }
            }
        }
        delta.getContentRefs().forEach((conceptId, refs) -> refs.forEach((type, ref) -> {
            if (ref == null || ref.isBlank()) {
                throw new InvalidStateDeltaException("Blank content ref for " + conceptId + "/" + type.wireName());
            }
        }));
    }

    private static Set<String> unionKeys(StateDelta delta) {
        Set<String> keys = new HashSet<>(delta.getContentRefs().keySet());
        keys.addAll(delta.getFailedConcepts().keySet());
        return keys;
    }

    /** Failure set flattened for logging and retry payloads. */
    public Map<String, List<String>> failureSummary() {
        Map<String, List<String>> summary = new HashMap<>();
        failedConcepts.forEach((conceptId, types) -> summary.put(conceptId,
                types.stream().map(ContentType::wireName).sorted().toList()));
        return summary;
    }

    /**
     * Folds the outcome of a retry job into a finished run. Unlike {@link #apply},
     * units that now have content leave the failure set.
     */
    public void recover(Map<String, Map<ContentType, String>> recoveredRefs,
                        Map<String, Set<ContentType>> stillFailed) {
        StateDelta check = StateDelta.builder().contentRefs(recoveredRefs).failedConcepts(stillFailed).build();
        validate(check);

        recoveredRefs.forEach((conceptId, refs) -> {
            contentRefs.computeIfAbsent(conceptId, k -> new TreeMap<>()).putAll(refs);
            Set<ContentType> failed = failedConcepts.get(conceptId);
            if (failed != null) {
                failed.removeAll(refs.keySet());
                if (failed.isEmpty()) {
                    failedConcepts.remove(conceptId);
                }
            }
        });
        stillFailed.forEach((conceptId, types) -> {
            if (!types.isEmpty()) {
                failedConcepts.computeIfAbsent(conceptId, k -> EnumSet.noneOf(ContentType.class)).addAll(types);
            }
        });
        updatedAt = Instant.now();
    }
}
