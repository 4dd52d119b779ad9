package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.LearningPreferences;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.UnitKey;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything a worker needs to run one content job, detached from the run's
 * checkpointed state. Travels through the broker as JSON.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentJobPayload {

    private String jobId;
    private String runId;
    private String roadmapId;
    private String userId;
    private RoadmapFramework framework;
    private LearningPreferences preferences;

    @Builder.Default
    private List<ContentType> contentTypes = new ArrayList<>();

    // Non-empty only for a retry job: the exact units to regenerate
    @Builder.Default
    private List<UnitKey> retryUnits = new ArrayList<>();

    private int concurrencyLimit;

    public boolean retryJob() {
        return retryUnits != null && !retryUnits.isEmpty();
    }
}
