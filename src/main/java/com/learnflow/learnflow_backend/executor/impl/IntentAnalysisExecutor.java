package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.executor.agent.Agent;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.model.roadmap.IntentAnalysis;
import com.learnflow.learnflow_backend.model.roadmap.UserRequest;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the learner's goal and fixes the run's roadmap id. The id proposed by
 * the agent is kept when unused; otherwise its suffix is regenerated.
 */
@Slf4j
@Component
public class IntentAnalysisExecutor implements StageExecutor {

    static final int MAX_SUFFIX_ATTEMPTS = 10;
    private static final Pattern SUFFIXED = Pattern.compile("^(.+)-([a-z0-9]{8})$");

    private final Agent<UserRequest, IntentAnalysis> intentAnalyzer;
    private final WorkflowStore store;
    private final TransientRetry retry;

    public IntentAnalysisExecutor(Agent<UserRequest, IntentAnalysis> intentAnalyzer,
                                  WorkflowStore store,
                                  TransientRetry retry) {
        this.intentAnalyzer = intentAnalyzer;
        this.store = store;
        this.retry = retry;
    }

    @Override
    public WorkflowStage supportedStage() {
        return WorkflowStage.INTENT_ANALYSIS;
    }

    @Override
    public StageResult execute(WorkflowState state) {
        IntentAnalysis analysis = intentAnalyzer.execute(state.getUserRequest());
        if (analysis == null || analysis.getParsedGoal() == null) {
            throw new AgentException(intentAnalyzer.name(), "no goal could be parsed from the request");
        }

        // A run that already owns a roadmap id keeps it
        String roadmapId = state.getRoadmapId() != null
                ? state.getRoadmapId()
                : uniqueRoadmapId(proposedId(analysis));
        analysis.setRoadmapId(roadmapId);

        log.info("[ENGINE] runId={} intent parsed goal='{}' roadmapId={}",
                state.getRunId(), analysis.getParsedGoal(), roadmapId);
        return StageResult.advance(StateDelta.builder()
                .intentAnalysis(analysis)
                .roadmapId(roadmapId)
                .historyEntry("intent_analysis: roadmap " + roadmapId)
                .build());
    }

    String uniqueRoadmapId(String candidate) {
        if (!exists(candidate)) {
            return candidate;
        }
        Matcher matcher = SUFFIXED.matcher(candidate);
        String base = matcher.matches() ? matcher.group(1) : candidate;

        for (int attempt = 1; attempt <= MAX_SUFFIX_ATTEMPTS; attempt++) {
            String regenerated = base + "-" + randomHex(8);
            if (!exists(regenerated)) {
                log.info("[ENGINE] roadmap id {} taken, regenerated as {} (attempt {})", candidate, regenerated, attempt);
                return regenerated;
            }
        }
        String fallback = base + "-" + randomHex(12);
        log.warn("[ENGINE] roadmap id {} still taken after {} attempts, using {}", candidate, MAX_SUFFIX_ATTEMPTS, fallback);
        return fallback;
    }

    private boolean exists(String roadmapId) {
        return retry.call("check roadmap id " + roadmapId, () -> store.roadmapIdExists(roadmapId));
    }

    private static String proposedId(IntentAnalysis analysis) {
        String raw = analysis.getRoadmapId() != null && !analysis.getRoadmapId().isBlank()
                ? analysis.getRoadmapId()
                : analysis.getParsedGoal();
        String slug = raw.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+)|(-+$)", "");
        if (slug.length() > 60) {
            slug = slug.substring(0, 60).replaceAll("-+$", "");
        }
        if (slug.isEmpty()) {
            slug = "roadmap";
        }
        return SUFFIXED.matcher(slug).matches() ? slug : slug + "-" + randomHex(8);
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }
}
