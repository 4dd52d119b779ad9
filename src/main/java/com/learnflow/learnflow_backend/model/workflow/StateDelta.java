package com.learnflow.learnflow_backend.model.workflow;

import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.IntentAnalysis;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Partial update produced by one stage (or by the router on a transition).
 * Null fields leave the state untouched; the two content maps are merged per
 * sub-key so concurrent writers never clobber each other.
 */
@Data
@Builder
public class StateDelta {

    private String roadmapId;
    private IntentAnalysis intentAnalysis;
    private RoadmapFramework framework;
    private ValidationResult validationResult;

    @Builder.Default
    private Map<String, Map<ContentType, String>> contentRefs = new HashMap<>();

    @Builder.Default
    private Map<String, Set<ContentType>> failedConcepts = new HashMap<>();

    private Integer validationRetryCount;
    private Boolean validationExhausted;
    private Boolean humanApproved;
    private String reviewFeedback;
    private EditSource editSource;

    private AwaitReason awaiting;
    private boolean clearAwaiting;
    private String contentJobId;

    private String historyEntry;

    public static StateDelta empty() {
        return StateDelta.builder().build();
    }

    public static StateDelta history(String entry) {
        return StateDelta.builder().historyEntry(entry).build();
    }
}
