package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.model.roadmap.Concept;
import com.learnflow.learnflow_backend.model.roadmap.CurriculumRequest;
import com.learnflow.learnflow_backend.model.roadmap.RoadmapFramework;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Designs the roadmap and stores its first version. Concept ids are prefixed
 * with the roadmap id so they are unique across roadmaps.
 */
@Slf4j
@Component
public class CurriculumDesignExecutor implements StageExecutor {

    private final Agent<CurriculumRequest, RoadmapFramework> curriculumArchitect;
    private final WorkflowStore store;
    private final TransientRetry retry;

    public CurriculumDesignExecutor(Agent<CurriculumRequest, RoadmapFramework> curriculumArchitect,
                                    WorkflowStore store,
                                    TransientRetry retry) {
        this.curriculumArchitect = curriculumArchitect;
        this.store = store;
        this.retry = retry;
    }

    @Override
    public WorkflowStage supportedStage() {
        return WorkflowStage.CURRICULUM_DESIGN;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        String roadmapId = state.getRoadmapId();
        if (roadmapId == null) {
            throw new IllegalStateException("curriculum_design reached without a roadmap id for run " + state.getRunId());
        }

        RoadmapFramework framework = curriculumArchitect.execute(
                new CurriculumRequest(state.getIntentAnalysis(), state.getUserRequest(), roadmapId));
        if (framework == null || framework.allConcepts().isEmpty()) {
            throw new AgentException(curriculumArchitect.name(), "framework has no concepts");
        }
        framework.setRoadmapId(roadmapId);
        prefixConceptIds(framework, roadmapId);

        String userId = state.getUserRequest() != null ? state.getUserRequest().getUserId() : null;
        retry.run("save roadmap " + roadmapId, () -> store.saveRoadmap(state.getRunId(), userId, framework));

        int concepts = framework.allConcepts().size();
        log.info("[ENGINE] runId={} roadmap {} designed: {} stages, {} concepts",
                state.getRunId(), roadmapId, framework.getStages().size(), concepts);
        return StageResult.advance(StateDelta.builder()
                .framework(framework)
                .historyEntry("curriculum_design: " + framework.getStages().size() + " stages, " + concepts + " concepts")
                .build());
    }

    static void prefixConceptIds(RoadmapFramework framework, String roadmapId) {
        List<Concept> concepts = framework.allConcepts();
        Set<String> seen = new HashSet<>();
        for (Concept concept : concepts) {
            String id = concept.getConceptId();
            if (id == null || id.isBlank()) {
                throw new AgentException("curriculum_architect", "concept '" + concept.getName() + "' has no id");
            }
            if (!id.startsWith(roadmapId + ":")) {
                id = roadmapId + ":" + id;
                concept.setConceptId(id);
            }
            if (!seen.add(id)) {
                throw new AgentException("curriculum_architect", "duplicate concept id " + id);
            }
        }
    }
}
