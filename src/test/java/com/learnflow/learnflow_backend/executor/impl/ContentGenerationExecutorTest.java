package com.learnflow.learnflow_backend.executor.impl;

import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.job.BrokerTask;
import com.learnflow.learnflow_backend.job.ContentGenerationJob;
import com.learnflow.learnflow_backend.job.ContentGeneratorRegistry;
import com.learnflow.learnflow_backend.job.ContentJobSettings;
import com.learnflow.learnflow_backend.job.InMemoryJobBroker;
import com.learnflow.learnflow_backend.job.JobDispatcher;
import com.learnflow.learnflow_backend.job.KeyAllocator;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowState;
import com.learnflow.learnflow_backend.support.Fixtures;
import com.learnflow.learnflow_backend.support.InMemoryWorkflowStore;
import com.learnflow.learnflow_backend.support.RecordingNotifications;
import com.learnflow.learnflow_backend.support.ScriptedGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.learnflow.learnflow_backend.support.Fixtures.ROADMAP_ID;
import static com.learnflow.learnflow_backend.support.Fixtures.conceptId;
import static org.assertj.core.api.Assertions.assertThat;

class ContentGenerationExecutorTest {

    private InMemoryJobBroker broker;
    private InMemoryWorkflowStore store;
    private LearnflowProperties properties;
    private JobDispatcher dispatcher;
    private ContentGenerationJob job;
    private WorkflowState state;

    @BeforeEach
    void setUp() {
        broker = new InMemoryJobBroker();
        store = new InMemoryWorkflowStore();
        properties = new LearnflowProperties();
        dispatcher = new JobDispatcher(broker, store, TransientRetry.none(), ContentJobSettings.defaults());

        ContentGeneratorRegistry registry = new ContentGeneratorRegistry(List.of(
                ScriptedGenerator.echo(ContentType.TUTORIAL),
                ScriptedGenerator.echo(ContentType.RESOURCE),
                new ScriptedGenerator(ContentType.QUIZ, r -> {
                    throw new IllegalStateException("quiz model unavailable");
                })));
        registry.init();
        job = new ContentGenerationJob(new KeyAllocator(minQuota -> List.of()), registry, store,
                new RecordingNotifications(), TransientRetry.none(), ContentJobSettings.defaults());

        state = Fixtures.state("run-1", WorkflowConfig.defaults());
        state.apply(StateDelta.builder()
                .roadmapId(ROADMAP_ID)
                .framework(Fixtures.framework(ROADMAP_ID, 2))
                .build());
    }

    private ContentGenerationExecutor executor() {
        return new ContentGenerationExecutor(dispatcher, job, store, TransientRetry.none(), properties);
    }

    @Test
    void brokerModeDispatchesAndParksTheRun() {
        StageResult result = executor().execute(state);

        assertThat(result.suspended()).isTrue();
        assertThat(result.awaitReason()).isEqualTo(AwaitReason.CONTENT_JOB);
        String jobId = result.delta().getContentJobId();
        BrokerTask task = broker.take(Duration.ofMillis(50)).orElseThrow();
        assertThat(task.payload().getJobId()).isEqualTo(jobId);
        assertThat(store.jobs).containsKey(jobId);
    }

    @Test
    void inlineModeRunsTheJobAndReturnsItsOutcome() {
        properties.getContent().setDispatchMode(LearnflowProperties.DispatchMode.INLINE);

        StageResult result = executor().execute(state);

        assertThat(result.suspended()).isFalse();
        assertThat(result.delta().getContentRefs()).containsOnlyKeys(conceptId(ROADMAP_ID, 1), conceptId(ROADMAP_ID, 2));
        assertThat(result.delta().getFailedConcepts().get(conceptId(ROADMAP_ID, 1))).containsExactly(ContentType.QUIZ);
        assertThat(result.delta().getHistoryEntry()).endsWith("partial_failure");
        assertThat(store.jobs.get(result.delta().getContentJobId()).getStatus()).isEqualTo(ContentJobStatus.PARTIAL_FAILURE);
        assertThat(broker.take(Duration.ofMillis(20))).isEmpty();
    }
}
