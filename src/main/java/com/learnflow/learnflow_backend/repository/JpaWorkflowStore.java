package com.learnflow.learnflow_backend.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.domain.ContentJobRecord;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.domain.GeneratedContent;
import com.learnflow.learnflow_backend.model.domain.RoadmapRecord;
import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.roadmap.Concept;
import com.learnflow.learnflow_backend.model.roadmap.ContentUnit;
import com.learnflow.learnflow_backend.model.roadmap.ContentUnitStatus;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.roadmap.UnitKey;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaWorkflowStore implements WorkflowStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final WorkflowRunRepository runRepository;
    private final RoadmapRecordRepository roadmapRepository;
    private final GeneratedContentRepository contentRepository;
    private final ContentJobRepository jobRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<WorkflowRun> getRun(String runId) {
        return runRepository.findById(runId);
    }

    @Override
    @Transactional
    public void createRun(WorkflowState state) {
        if (runRepository.existsById(state.getRunId())) {
            return;
        }
        WorkflowRun run = new WorkflowRun();
        run.setRunId(state.getRunId());
        run.setTraceId(state.getTraceId());
        run.setUserId(state.getUserRequest() != null ? state.getUserRequest().getUserId() : null);
        run.setStatus(RunStatus.PROCESSING);
        run.setCurrentStage(state.getCurrentStage().wireName());
        runRepository.save(run);
    }

    @Override
    @Transactional
    public void updateStatus(String runId, RunStatus status, String stage, String errorMessage) {
        Optional<WorkflowRun> found = runRepository.findById(runId);
        if (found.isEmpty()) {
            log.warn("Status update for unknown run {} ignored (status={})", runId, status);
            return;
        }
        WorkflowRun run = found.get();
        run.setStatus(status);
        if (stage != null) {
            run.setCurrentStage(stage);
        }
        if (errorMessage != null) {
            run.setErrorMessage(truncate(errorMessage, WorkflowRun.MAX_ERROR_LENGTH));
        }
        if (status.isTerminal() && run.getCompletedAt() == null) {
            run.setCompletedAt(Instant.now());
        }
        runRepository.save(run);
    }

    @Override
    @Transactional
    public void archive(WorkflowState state, RunStatus status) {
        WorkflowRun run = runRepository.findById(state.getRunId()).orElseGet(() -> {
            WorkflowRun created = new WorkflowRun();
            created.setRunId(state.getRunId());
            created.setTraceId(state.getTraceId());
            return created;
        });
        run.setStatus(status);
        run.setCurrentStage(state.getCurrentStage().wireName());
        run.setRoadmapId(state.getRoadmapId());
        run.setContentJobId(state.getContentJobId());
        run.setFailedConcepts(new LinkedHashMap<>(state.failureSummary()));
        run.setStateSnapshot(objectMapper.convertValue(state, MAP_TYPE));
        if (run.getCompletedAt() == null) {
            run.setCompletedAt(Instant.now());
        }
        runRepository.save(run);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean roadmapIdExists(String roadmapId) {
        return roadmapRepository.existsById(roadmapId);
    }

    @Override
    @Transactional
    public void saveRoadmap(String runId, String userId, RoadmapFramework framework) {
        RoadmapRecord record = roadmapRepository.findById(framework.getRoadmapId()).orElseGet(RoadmapRecord::new);
        record.setRoadmapId(framework.getRoadmapId());
        record.setRunId(runId);
        record.setUserId(userId);
        record.setTitle(framework.getTitle());
        record.setFrameworkData(objectMapper.convertValue(framework, MAP_TYPE));
        roadmapRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<UnitKey, String> findCompletedUnits(String roadmapId) {
        Map<UnitKey, String> stored = new HashMap<>();
        for (GeneratedContent row : contentRepository.findByRoadmapId(roadmapId)) {
            stored.put(new UnitKey(row.getConceptId(), row.getContentType()), row.getResultRef());
        }
        return stored;
    }

    @Override
    @Transactional
    public void saveContentBatch(String roadmapId, String jobId, List<ContentUnit> batch) {
        for (ContentUnit unit : batch) {
            if (unit.getStatus() != ContentUnitStatus.COMPLETED) {
                continue;
            }
            // Upsert on the natural key so a replayed batch rewrites the same rows
            GeneratedContent row = contentRepository
                    .findByRoadmapIdAndConceptIdAndContentType(roadmapId, unit.getConceptId(), unit.getContentType())
                    .orElseGet(GeneratedContent::new);
            row.setRoadmapId(roadmapId);
            row.setConceptId(unit.getConceptId());
            row.setContentType(unit.getContentType());
            row.setResultRef(unit.getResultRef());
            row.setContent(unit.getContent());
            row.setJobId(jobId);
            row.setUpdatedAt(Instant.now());
            contentRepository.save(row);
        }
    }

    @Override
    @Transactional
    public void updateFrameworkStatuses(String roadmapId, Collection<ContentUnit> units) {
        Optional<RoadmapRecord> found = roadmapRepository.findById(roadmapId);
        if (found.isEmpty()) {
            log.warn("No stored roadmap {}, skipping concept status update", roadmapId);
            return;
        }
        RoadmapRecord record = found.get();
        RoadmapFramework framework = objectMapper.convertValue(record.getFrameworkData(), RoadmapFramework.class);
        for (ContentUnit unit : units) {
            framework.findConcept(unit.getConceptId()).ifPresent(concept -> applyUnitStatus(concept, unit));
        }
        record.setFrameworkData(objectMapper.convertValue(framework, MAP_TYPE));
        roadmapRepository.save(record);
    }

    private static void applyUnitStatus(Concept concept, ContentUnit unit) {
        String status = unit.getStatus() == ContentUnitStatus.COMPLETED ? "completed" : "failed";
        String ref = unit.getStatus() == ContentUnitStatus.COMPLETED ? unit.getResultRef() : null;
        switch (unit.getContentType()) {
            case TUTORIAL -> {
                concept.setContentStatus(status);
                if (ref != null) concept.setTutorialRef(ref);
            }
            case RESOURCE -> {
                concept.setResourcesStatus(status);
                if (ref != null) concept.setResourcesRef(ref);
            }
            case QUIZ -> {
                concept.setQuizStatus(status);
                if (ref != null) concept.setQuizRef(ref);
            }
        }
    }

    @Override
    @Transactional
    public void recordJob(String jobId, String runId, String brokerTaskId) {
        ContentJobRecord record = jobRepository.findById(jobId).orElseGet(ContentJobRecord::new);
        record.setJobId(jobId);
        record.setRunId(runId);
        record.setBrokerTaskId(brokerTaskId);
        // A fast worker may have completed the job already
        if (record.getStatus() == null || !record.getStatus().isTerminal()) {
            record.setStatus(ContentJobStatus.QUEUED);
        }
        jobRepository.save(record);

        runRepository.findById(runId).ifPresent(run -> {
            run.setContentJobId(jobId);
            runRepository.save(run);
        });
    }

    @Override
    @Transactional
    public void completeJob(JobResult result) {
        ContentJobRecord record = jobRepository.findById(result.getJobId()).orElseGet(() -> {
            ContentJobRecord created = new ContentJobRecord();
            created.setJobId(result.getJobId());
            created.setRunId(result.getRunId());
            return created;
        });
        record.setStatus(result.getStatus());
        record.setFailedConceptCount(result.failedConceptCount());
        record.setFailedUnits(result.failureSummary());
        record.setExecutionSummary(result.executionSummary());
        record.setCompletedAt(Instant.now());
        jobRepository.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ContentJobRecord> getJob(String jobId) {
        return jobRepository.findById(jobId);
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) : s;
    }
}
