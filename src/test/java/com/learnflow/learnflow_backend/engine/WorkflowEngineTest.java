package com.learnflow.learnflow_backend.engine;

import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.executor.agent.AgentException;
import com.learnflow.learnflow_backend.job.JobResult;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.domain.WorkflowRun;
import com.learnflow.learnflow_backend.model.event.ProgressEventType;
import com.learnflow.learnflow_backend.model.roadmap.Concept;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.ValidationIssue;
import com.learnflow.learnflow_backend.model.roadmap.ValidationResult;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.EditSource;
import com.learnflow.learnflow_backend.model.workflow.HumanDecision;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.support.Fixtures;
import com.learnflow.learnflow_backend.support.InMemoryCheckpointStore;
import com.learnflow.learnflow_backend.support.InMemoryWorkflowStore;
import com.learnflow.learnflow_backend.support.RecordingNotifications;
import com.learnflow.learnflow_backend.support.ScriptedExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.learnflow.learnflow_backend.support.Fixtures.ROADMAP_ID;
import static com.learnflow.learnflow_backend.support.Fixtures.conceptId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class WorkflowEngineTest {

    private static final WorkflowConfig FAST_PATH = WorkflowConfig.builder()
            .skipValidation(true)
            .skipHumanReview(true)
            .build();

    /** Stands in for the process dying mid-stage: not a RuntimeException, so no failure path runs. */
    static class SimulatedCrash extends Error {
        SimulatedCrash() {
            super("process killed");
        }
    }

    private InMemoryCheckpointStore checkpoints;
    private InMemoryWorkflowStore store;
    private RecordingNotifications notifications;

    private ScriptedExecutor intent;
    private ScriptedExecutor curriculum;
    private ScriptedExecutor validation;
    private ScriptedExecutor edit;
    private ScriptedExecutor review;
    private ScriptedExecutor content;

    @BeforeEach
    void setUp() {
        checkpoints = new InMemoryCheckpointStore();
        store = new InMemoryWorkflowStore();
        notifications = new RecordingNotifications();

        intent = new ScriptedExecutor(WorkflowStage.INTENT_ANALYSIS,
                (s, n) -> StageResult.advance(StateDelta.builder().roadmapId(ROADMAP_ID).build()));
        curriculum = new ScriptedExecutor(WorkflowStage.CURRICULUM_DESIGN,
                (s, n) -> StageResult.advance(StateDelta.builder().framework(Fixtures.framework(ROADMAP_ID, 2)).build()));
        validation = new ScriptedExecutor(WorkflowStage.STRUCTURE_VALIDATION,
                (s, n) -> StageResult.advance(StateDelta.builder().validationResult(ValidationResult.passed()).build()));
        edit = new ScriptedExecutor(WorkflowStage.ROADMAP_EDIT,
                (s, n) -> StageResult.advance(StateDelta.builder().framework(Fixtures.framework(ROADMAP_ID, 2)).build()));
        review = new ScriptedExecutor(WorkflowStage.HUMAN_REVIEW,
                (s, n) -> StageResult.suspend(AwaitReason.HUMAN_REVIEW, StateDelta.empty()));
        content = new ScriptedExecutor(WorkflowStage.CONTENT_GENERATION,
                (s, n) -> StageResult.advance(StateDelta.builder().contentRefs(tutorialsFor(s)).build()));
    }

    private WorkflowEngine engine() {
        return engine(200);
    }

    // A fresh engine over the same stores plays the part of a restarted process
    private WorkflowEngine engine(int maxStageExecutions) {
        WorkflowGraph graph = GraphBuilder.create()
                .executors(List.of(intent, curriculum, validation, edit, review, content))
                .router(new WorkflowRouter())
                .maxStageExecutions(maxStageExecutions)
                .build();
        return new WorkflowEngine(graph, checkpoints, store, new StateManager(),
                new WorkflowErrorHandler(store, notifications), notifications, TransientRetry.none());
    }

    private static Map<String, Map<ContentType, String>> tutorialsFor(WorkflowState state) {
        Map<String, Map<ContentType, String>> refs = new TreeMap<>();
        for (Concept concept : state.getFramework().allConcepts()) {
            refs.put(concept.getConceptId(), Map.of(ContentType.TUTORIAL, ROADMAP_ID + "/" + concept.getConceptId() + "/tutorial"));
        }
        return refs;
    }

    @Test
    void skippingValidationAndReviewGoesStraightToContent() {
        WorkflowResult result = engine().execute(Fixtures.state("run-1", FAST_PATH));

        assertThat(result.isFinal()).isTrue();
        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(validation.calls()).isZero();
        assertThat(review.calls()).isZero();
        assertThat(edit.calls()).isZero();
        assertThat(content.calls()).isEqualTo(1);
        assertThat(checkpoints.history("run-1")).extracting(Checkpoint::stage).containsExactly(
                WorkflowStage.INIT, WorkflowStage.INTENT_ANALYSIS, WorkflowStage.CURRICULUM_DESIGN,
                WorkflowStage.CONTENT_GENERATION, WorkflowStage.COMPLETED);
        assertThat(store.run("run-1").getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void checkpointChainIsLinkedAndMonotonic() {
        engine().execute(Fixtures.state("run-1", FAST_PATH));

        List<Checkpoint> history = checkpoints.history("run-1");
        assertThat(history.get(0).parentSequenceId()).isNull();
        for (int i = 1; i < history.size(); i++) {
            assertThat(history.get(i).sequenceId()).isEqualTo(i);
            assertThat(history.get(i).parentSequenceId()).isEqualTo(i - 1L);
        }
    }

    @Test
    void validationThatPassesOnThirdAttemptRunsTwoEdits() {
        validation.script((s, n) -> StageResult.advance(StateDelta.builder()
                .validationResult(n <= 2
                        ? ValidationResult.failed(new ValidationIssue("high", "stage 1", "missing prerequisites"))
                        : ValidationResult.passed())
                .build()));

        WorkflowResult result = engine().execute(Fixtures.state("run-2", WorkflowConfig.defaults()));

        assertThat(validation.calls()).isEqualTo(3);
        assertThat(edit.calls()).isEqualTo(2);
        assertThat(result.isSuspended()).isTrue();
        assertThat(result.awaiting()).isEqualTo(AwaitReason.HUMAN_REVIEW);
        assertThat(result.status()).isEqualTo(RunStatus.HUMAN_REVIEW_PENDING);
        assertThat(result.state().getValidationRetryCount()).isEqualTo(2);
        assertThat(result.state().isValidationExhausted()).isFalse();
    }

    @Test
    void validationLoopEndsInReviewOnceRetriesAreExhausted() {
        validation.script((s, n) -> StageResult.advance(StateDelta.builder()
                .validationResult(ValidationResult.failed(new ValidationIssue("high", "module 2", "too broad")))
                .build()));

        WorkflowResult result = engine().execute(Fixtures.state("run-3", WorkflowConfig.defaults()));

        assertThat(validation.calls()).isEqualTo(4);
        assertThat(edit.calls()).isEqualTo(3);
        assertThat(result.state().isValidationExhausted()).isTrue();
        assertThat(result.awaiting()).isEqualTo(AwaitReason.HUMAN_REVIEW);
    }

    @Test
    void approvalResumesIntoContentGeneration() {
        WorkflowEngine engine = engine();
        WorkflowResult parked = engine.execute(Fixtures.state("run-4", WorkflowConfig.defaults()));
        assertThat(parked.isSuspended()).isTrue();
        assertThat(store.run("run-4").getStatus()).isEqualTo(RunStatus.HUMAN_REVIEW_PENDING);

        WorkflowResult result = engine.resume("run-4", HumanDecision.approve());

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.state().getContentRefs()).containsKeys(conceptId(ROADMAP_ID, 1), conceptId(ROADMAP_ID, 2));
        assertThat(notifications.types()).contains(ProgressEventType.COMPLETED);
    }

    @Test
    void rejectionCarriesFeedbackIntoEdit() {
        WorkflowEngine engine = engine();
        engine.execute(Fixtures.state("run-5", WorkflowConfig.defaults()));
        edit.script((s, n) -> {
            assertThat(s.getEditSource()).isEqualTo(EditSource.HUMAN_REVIEW);
            assertThat(s.getReviewFeedback()).isEqualTo("add a project module");
            return StageResult.advance(StateDelta.builder().framework(Fixtures.framework(ROADMAP_ID, 3)).build());
        });

        WorkflowResult result = engine.resume("run-5", HumanDecision.reject("add a project module"));

        assertThat(edit.calls()).isEqualTo(1);
        assertThat(validation.calls()).isEqualTo(2);
        assertThat(review.calls()).isEqualTo(2);
        assertThat(result.isSuspended()).isTrue();
        assertThat(result.state().getFramework().allConcepts()).hasSize(3);
    }

    @Test
    void resumeOfFinishedOrUnknownRun() {
        engine().execute(Fixtures.state("run-6", FAST_PATH));

        WorkflowResult again = engine().resume("run-6", HumanDecision.approve());

        assertThat(again.isFinal()).isTrue();
        assertThrows(IllegalArgumentException.class, () -> engine().resume("nope", HumanDecision.approve()));
    }

    @Test
    void restartAfterCrashContinuesFromLastCheckpoint() {
        WorkflowResult reference = engine().execute(Fixtures.state("reference", FAST_PATH));
        int intentCallsBefore = intent.calls();

        curriculum.script((s, n) -> {
            if (n == 2) {
                throw new SimulatedCrash();
            }
            return StageResult.advance(StateDelta.builder().framework(Fixtures.framework(ROADMAP_ID, 2)).build());
        });
        WorkflowState initial = Fixtures.state("crashy", FAST_PATH);
        assertThrows(SimulatedCrash.class, () -> engine().execute(initial));
        assertThat(checkpoints.latest("crashy")).get().extracting(Checkpoint::stage).isEqualTo(WorkflowStage.INTENT_ANALYSIS);

        WorkflowResult recovered = engine().execute(Fixtures.state("crashy", FAST_PATH));

        assertThat(intent.calls() - intentCallsBefore).isEqualTo(1);
        assertThat(recovered.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(recovered.state().getExecutionHistory()).isEqualTo(reference.state().getExecutionHistory());
        assertThat(recovered.state().getContentRefs()).isEqualTo(reference.state().getContentRefs());
        assertThat(recovered.state().getFramework()).isEqualTo(reference.state().getFramework());
    }

    @Test
    void resumeAgainAfterACrashPastTheDecisionContinuesTheRun() {
        engine().execute(Fixtures.state("run-16", WorkflowConfig.defaults()));
        content.script((s, n) -> {
            if (n == 1) {
                throw new SimulatedCrash();
            }
            return StageResult.advance(StateDelta.builder().contentRefs(tutorialsFor(s)).build());
        });
        assertThrows(SimulatedCrash.class, () -> engine().resume("run-16", HumanDecision.approve()));
        Checkpoint afterDecision = checkpoints.latest("run-16").orElseThrow();
        assertThat(afterDecision.stage()).isEqualTo(WorkflowStage.HUMAN_REVIEW);
        assertThat(afterDecision.state().getAwaiting()).isNull();

        WorkflowResult result = engine().resume("run-16", HumanDecision.approve());

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(content.calls()).isEqualTo(2);
        assertThat(review.calls()).isEqualTo(1);
        assertThat(result.state().getExecutionHistory()).containsOnlyOnce("human_review: approved");
        assertThat(store.run("run-16").getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void executingAFinishedRunReturnsItsResultWithoutRerunning() {
        engine().execute(Fixtures.state("run-7", FAST_PATH));

        WorkflowResult again = engine().execute(Fixtures.state("run-7", FAST_PATH));

        assertThat(again.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(intent.calls()).isEqualTo(1);
        assertThat(content.calls()).isEqualTo(1);
    }

    @Test
    void stageFailureMarksRunFailedAndRethrows() {
        curriculum.script((s, n) -> {
            throw new AgentException("curriculum_architect", "x".repeat(700));
        });

        assertThrows(AgentException.class, () -> engine().execute(Fixtures.state("run-8", WorkflowConfig.defaults())));

        WorkflowRun run = store.run("run-8");
        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getErrorMessage()).hasSize(WorkflowRun.MAX_ERROR_LENGTH).startsWith("[curriculum_architect]");
        assertThat(checkpoints.latest("run-8")).get().extracting(Checkpoint::stage).isEqualTo(WorkflowStage.FAILED);
        assertThat(notifications.ofType(ProgressEventType.FAILED)).hasSize(1);
        assertThat(validation.calls()).isZero();
    }

    @Test
    void runawayLoopHitsTheStageExecutionCap() {
        validation.script((s, n) -> StageResult.advance(StateDelta.builder()
                .validationResult(ValidationResult.failed(new ValidationIssue("low", "x", "y")))
                .build()));

        assertThrows(WorkflowConfigurationException.class,
                () -> engine(4).execute(Fixtures.state("run-9", WorkflowConfig.defaults())));
        assertThat(store.run("run-9").getStatus()).isEqualTo(RunStatus.FAILED);
    }

    @Test
    void contentJobResultIsFoldedIntoParkedRun() {
        content.script((s, n) -> StageResult.suspend(AwaitReason.CONTENT_JOB,
                StateDelta.builder().contentJobId("job-1").build()));
        WorkflowEngine engine = engine();

        WorkflowResult parked = engine.execute(Fixtures.state("run-10", FAST_PATH));
        assertThat(parked.status()).isEqualTo(RunStatus.CONTENT_GENERATING);
        assertThat(parked.awaiting()).isEqualTo(AwaitReason.CONTENT_JOB);

        WorkflowResult result = engine.completeContentGeneration("run-10", partialResult("job-1", false));

        assertThat(result.status()).isEqualTo(RunStatus.PARTIAL_FAILURE);
        assertThat(result.state().getFailedConcepts())
                .containsEntry(conceptId(ROADMAP_ID, 2), EnumSet.of(ContentType.QUIZ));
        assertThat(store.run("run-10").getFailedConcepts())
                .containsEntry(conceptId(ROADMAP_ID, 2), List.of("quiz"));
    }

    @Test
    void resultOfAnotherJobIsRejected() {
        content.script((s, n) -> StageResult.suspend(AwaitReason.CONTENT_JOB,
                StateDelta.builder().contentJobId("job-1").build()));
        WorkflowEngine engine = engine();
        engine.execute(Fixtures.state("run-11", FAST_PATH));

        assertThatThrownBy(() -> engine.completeContentGeneration("run-11", partialResult("job-other", false)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(engine.currentState("run-11")).get()
                .extracting(WorkflowState::getAwaiting).isEqualTo(AwaitReason.CONTENT_JOB);
    }

    @Test
    void resultArrivingBeforeTheRunParksIsTransient() {
        content.script((s, n) -> {
            throw new SimulatedCrash();
        });
        WorkflowEngine engine = engine();
        assertThrows(SimulatedCrash.class, () -> engine.execute(Fixtures.state("run-12", FAST_PATH)));

        assertThatThrownBy(() -> engine.completeContentGeneration("run-12", partialResult("job-1", false)))
                .isInstanceOf(TransientInfraException.class);
    }

    @Test
    void retryJobRecoversAFinishedRun() {
        content.script((s, n) -> StageResult.suspend(AwaitReason.CONTENT_JOB,
                StateDelta.builder().contentJobId("job-1").build()));
        WorkflowEngine engine = engine();
        engine.execute(Fixtures.state("run-13", FAST_PATH));
        engine.completeContentGeneration("run-13", partialResult("job-1", false));

        JobResult retry = JobResult.builder()
                .jobId("job-2")
                .runId("run-13")
                .roadmapId(ROADMAP_ID)
                .status(ContentJobStatus.COMPLETED)
                .retry(true)
                .contentRefs(Map.of(conceptId(ROADMAP_ID, 2),
                        Map.of(ContentType.QUIZ, ROADMAP_ID + "/" + conceptId(ROADMAP_ID, 2) + "/quiz")))
                .build();
        WorkflowResult result = engine.completeContentGeneration("run-13", retry);

        assertThat(result.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(result.state().hasFailures()).isFalse();
        assertThat(result.state().getContentRefs().get(conceptId(ROADMAP_ID, 2)))
                .containsKeys(ContentType.TUTORIAL, ContentType.QUIZ);
        assertThat(store.run("run-13").getStatus()).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void cancelledRunKeepsItsStatusWhenTheJobReports() {
        content.script((s, n) -> StageResult.suspend(AwaitReason.CONTENT_JOB,
                StateDelta.builder().contentJobId("job-1").build()));
        WorkflowEngine engine = engine();
        engine.execute(Fixtures.state("run-14", FAST_PATH));
        store.updateStatus("run-14", RunStatus.CANCELLED, "content_generation", "content job cancelled by request");

        WorkflowResult result = engine.completeContentGeneration("run-14",
                partialResult("job-1", false).toBuilder().status(ContentJobStatus.CANCELLED).build());

        assertThat(result.status()).isEqualTo(RunStatus.CANCELLED);
        assertThat(result.state().getCurrentStage()).isEqualTo(WorkflowStage.PARTIAL_FAILURE);
        assertThat(store.run("run-14").getStatus()).isEqualTo(RunStatus.CANCELLED);
    }

    @Test
    void failRunLeavesFinishedRunsAlone() {
        WorkflowEngine engine = engine();
        engine.execute(Fixtures.state("run-15", FAST_PATH));

        engine.failRun("run-15", new IllegalStateException("worker died"));

        assertThat(store.run("run-15").getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(checkpoints.latest("run-15")).get().extracting(Checkpoint::stage).isEqualTo(WorkflowStage.COMPLETED);
    }

    private static JobResult partialResult(String jobId, boolean retry) {
        Map<String, Map<ContentType, String>> refs = new TreeMap<>();
        refs.put(conceptId(ROADMAP_ID, 1), Map.of(
                ContentType.TUTORIAL, ROADMAP_ID + "/" + conceptId(ROADMAP_ID, 1) + "/tutorial",
                ContentType.QUIZ, ROADMAP_ID + "/" + conceptId(ROADMAP_ID, 1) + "/quiz"));
        refs.put(conceptId(ROADMAP_ID, 2), Map.of(
                ContentType.TUTORIAL, ROADMAP_ID + "/" + conceptId(ROADMAP_ID, 2) + "/tutorial"));
        Map<String, Set<ContentType>> failed = Map.of(conceptId(ROADMAP_ID, 2), EnumSet.of(ContentType.QUIZ));
        return JobResult.builder()
                .jobId(jobId)
                .runId("run")
                .roadmapId(ROADMAP_ID)
                .status(ContentJobStatus.PARTIAL_FAILURE)
                .retry(retry)
                .contentRefs(refs)
                .failedConcepts(failed)
                .totalUnits(4)
                .completedUnits(3)
                .failedUnits(1)
                .build();
    }
}
