package com.learnflow.learnflow_backend.repository;

import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.domain.ContentJobRecord;
import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.roadmap.ContentUnit;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.UnitKey;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational side of a run: the run row, the roadmap, generated content and
 * job records. Every method is its own transaction and safe to re-apply.
 */
public interface WorkflowStore {

    Optional<WorkflowRun> getRun(String runId);

    /** Inserts the run row if it does not exist yet. */
    void createRun(WorkflowState state);

    /** {@code errorMessage} is truncated to {@link WorkflowRun#MAX_ERROR_LENGTH}. */
    void updateStatus(String runId, RunStatus status, String stage, String errorMessage);

    /** Final snapshot of a run that reached a terminal stage. */
    void archive(WorkflowState state, RunStatus status);

    boolean roadmapIdExists(String roadmapId);

    void saveRoadmap(String runId, String userId, RoadmapFramework framework);

    /** Units already stored for the roadmap, with their content refs. */
    Map<UnitKey, String> findCompletedUnits(String roadmapId);

    /** Upserts one batch of completed units of a single content type. */
    void saveContentBatch(String roadmapId, String jobId, List<ContentUnit> batch);

    /** Writes per-concept status and ref fields into the stored roadmap. */
    void updateFrameworkStatuses(String roadmapId, Collection<ContentUnit> units);

    /** Job record, first write: at enqueue. */
    void recordJob(String jobId, String runId, String brokerTaskId);

    /** Job record, second and last write: at completion. */
    void completeJob(JobResult result);

    Optional<ContentJobRecord> getJob(String jobId);
}
