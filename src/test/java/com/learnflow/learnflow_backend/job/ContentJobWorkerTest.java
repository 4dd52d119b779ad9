package com.learnflow.learnflow_backend.job;

import com.learnflow.learnflow_backend.config.LearnflowProperties;
import com.learnflow.learnflow_backend.engine.Checkpoint;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.engine.WorkflowEngine;
import com.learnflow.learnflow_backend.executor.StageResult;
import com.learnflow.learnflow_backend.model.domain.ContentJobStatus;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.roadmap.UnitKey;
import com.learnflow.learnflow_backend.model.workflow.AwaitReason;
import com.learnflow.learnflow_backend.model.workflow.RunStatus;
import com.learnflow.learnflow_backend.model.workflow.StateDelta;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import com.learnflow.learnflow_backend.model.workflow.WorkflowStage;
import com.learnflow.learnflow_backend.support.EngineHarness;
import com.learnflow.learnflow_backend.support.Fixtures;
import com.learnflow.learnflow_backend.support.InMemoryWorkflowStore;
import com.learnflow.learnflow_backend.support.ScriptedGenerator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ContentJobWorkerTest {

    private static final WorkflowConfig FAST_PATH = WorkflowConfig.builder()
            .skipValidation(true)
            .skipHumanReview(true)
            .build();

    private final List<ScheduledExecutorService> watchdogs = new ArrayList<>();

    private InMemoryJobBroker broker;
    private LearnflowProperties properties;

    @BeforeEach
    void setUp() {
        broker = new InMemoryJobBroker();
        properties = new LearnflowProperties();
        properties.getBroker().setPollTimeout(Duration.ofMillis(20));
    }

    @AfterEach
    void tearDown() {
        watchdogs.forEach(ScheduledExecutorService::shutdownNow);
    }

    private EngineHarness parkedAtContent(InMemoryWorkflowStore store, String runId) {
        EngineHarness harness = new EngineHarness(store);
        JobDispatcher dispatcher = new JobDispatcher(broker, store, TransientRetry.none(), ContentJobSettings.defaults());
        harness.content.script((s, n) -> StageResult.suspend(AwaitReason.CONTENT_JOB,
                StateDelta.builder().contentJobId(dispatcher.dispatch(s)).build()));
        harness.engine().execute(Fixtures.state(runId, FAST_PATH));
        return harness;
    }

    private ContentGenerationJob contentJob(InMemoryWorkflowStore store, EngineHarness harness) {
        ContentGeneratorRegistry registry = new ContentGeneratorRegistry(List.of(
                ScriptedGenerator.echo(ContentType.TUTORIAL),
                ScriptedGenerator.echo(ContentType.RESOURCE),
                ScriptedGenerator.echo(ContentType.QUIZ)));
        registry.init();
        return new ContentGenerationJob(new KeyAllocator(minQuota -> List.of()), registry, store,
                harness.notifications, TransientRetry.none(), ContentJobSettings.defaults());
    }

    private ContentJobWorker worker(ContentGenerationJob job, WorkflowEngine engine, EngineHarness harness,
                                    ExecutorService executor) {
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor();
        watchdogs.add(watchdog);
        return new ContentJobWorker(broker, job, engine, harness.errorHandler, executor, watchdog, properties);
    }

    @Test
    void brokerStatusFollowsTheJobOutcome() {
        assertThat(ContentJobWorker.brokerStatusFor(ContentJobStatus.COMPLETED)).isEqualTo(BrokerTaskStatus.SUCCESS);
        assertThat(ContentJobWorker.brokerStatusFor(ContentJobStatus.PARTIAL_FAILURE)).isEqualTo(BrokerTaskStatus.SUCCESS);
        assertThat(ContentJobWorker.brokerStatusFor(ContentJobStatus.CANCELLED)).isEqualTo(BrokerTaskStatus.REVOKED);
        assertThat(ContentJobWorker.brokerStatusFor(ContentJobStatus.FAILED)).isEqualTo(BrokerTaskStatus.FAILURE);
    }

    @Test
    void finishedJobIsAcknowledgedAndFoldedIntoItsRun() {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        EngineHarness harness = parkedAtContent(store, "run-1");
        WorkflowEngine engine = harness.engine();
        ContentJobWorker worker = worker(contentJob(store, harness), engine, harness, mock(ExecutorService.class));

        BrokerTask task = broker.take(Duration.ofMillis(50)).orElseThrow();
        worker.process(task);

        assertThat(broker.poll(task.handle())).isEqualTo(BrokerTaskStatus.SUCCESS);
        assertThat(store.run("run-1").getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(store.jobs.get(task.payload().getJobId()).getStatus()).isEqualTo(ContentJobStatus.COMPLETED);
        assertThat(engine.currentState("run-1").orElseThrow().getContentRefs()).hasSize(2);
    }

    @Test
    void crashingJobFailsBothTheTaskAndTheRun() {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore() {
            @Override
            public Map<UnitKey, String> findCompletedUnits(String roadmapId) {
                throw new IllegalStateException("content table missing");
            }
        };
        EngineHarness harness = parkedAtContent(store, "run-2");
        WorkflowEngine engine = harness.engine();
        ContentJobWorker worker = worker(contentJob(store, harness), engine, harness, mock(ExecutorService.class));

        BrokerTask task = broker.take(Duration.ofMillis(50)).orElseThrow();
        worker.process(task);

        assertThat(broker.poll(task.handle())).isEqualTo(BrokerTaskStatus.FAILURE);
        assertThat(store.run("run-2").getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(store.jobs.get(task.payload().getJobId()).getStatus()).isEqualTo(ContentJobStatus.FAILED);
        assertThat(harness.checkpoints.latest("run-2")).get()
                .extracting(Checkpoint::stage).isEqualTo(WorkflowStage.FAILED);
    }

    @Test
    void pollTakesNoMoreTasksThanFreeSlots() {
        properties.getWorker().setPoolSize(2);
        ExecutorService executor = mock(ExecutorService.class);
        doReturn(mock(Future.class)).when(executor).submit(any(Runnable.class));
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        EngineHarness harness = new EngineHarness(store);
        ContentJobWorker worker = worker(contentJob(store, harness), harness.engine(), harness, executor);
        String first = broker.enqueue(ContentJobPayload.builder().jobId("job-1").runId("r1").build());
        String second = broker.enqueue(ContentJobPayload.builder().jobId("job-2").runId("r2").build());
        String third = broker.enqueue(ContentJobPayload.builder().jobId("job-3").runId("r3").build());

        worker.pollOnce();

        verify(executor, times(2)).submit(any(Runnable.class));
        assertThat(worker.freeSlots()).isZero();
        assertThat(broker.poll(first)).isEqualTo(BrokerTaskStatus.STARTED);
        assertThat(broker.poll(second)).isEqualTo(BrokerTaskStatus.STARTED);
        assertThat(broker.poll(third)).isEqualTo(BrokerTaskStatus.PENDING);
    }

    @Test
    void emptyQueueReturnsTheSlot() {
        InMemoryWorkflowStore store = new InMemoryWorkflowStore();
        EngineHarness harness = new EngineHarness(store);
        ContentJobWorker worker = worker(contentJob(store, harness), harness.engine(), harness, mock(ExecutorService.class));
        int before = worker.freeSlots();

        worker.pollOnce();

        assertThat(worker.freeSlots()).isEqualTo(before);
    }
}
