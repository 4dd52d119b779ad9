package com.learnflow.learnflow_backend.config;

import com.learnflow.learnflow_backend.engine.RetryConfig;
import com.learnflow.learnflow_backend.job.ContentJobSettings;
import com.learnflow.learnflow_backend.model.domain.LlmProvider;
import com.learnflow.learnflow_backend.model.roadmap.ContentType;
import com.learnflow.learnflow_backend.model.workflow.WorkflowConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything under {@code learnflow.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "learnflow")
public class LearnflowProperties {

    private Workflow workflow = new Workflow();
    private Content content = new Content();
    private Credentials credentials = new Credentials();
    private Broker broker = new Broker();
    private Worker worker = new Worker();
    private RetryConfig retry = new RetryConfig();
    private Agent agent = new Agent();

    /** Snapshot stored in a new run's state; later property changes do not reach it. */
    public WorkflowConfig workflowConfig() {
        return WorkflowConfig.builder()
                .skipValidation(workflow.isSkipValidation())
                .skipHumanReview(workflow.isSkipHumanReview())
                .skipContentGeneration(workflow.isSkipContentGeneration())
                .maxValidationRetries(workflow.getMaxValidationRetries())
                .contentConcurrencyLimit(content.getConcurrencyLimit())
                .build();
    }

    public ContentJobSettings contentJobSettings() {
        List<ContentType> types = content.getEnabledTypes().isEmpty()
                ? ContentJobSettings.defaults().enabledTypes()
                : List.copyOf(content.getEnabledTypes());
        return new ContentJobSettings(
                content.getConcurrencyLimit(),
                content.getBatchSize(),
                content.getFailureThreshold(),
                content.getUnitTimeout(),
                credentials.getMinQuota(),
                types);
    }

    @Data
    public static class Workflow {
        private boolean skipValidation = false;
        private boolean skipHumanReview = false;
        private boolean skipContentGeneration = false;
        private int maxValidationRetries = 3;
        private int maxStageExecutions = 200;
    }

    @Data
    public static class Content {
        private int concurrencyLimit = 30;
        private int batchSize = 10;
        private double failureThreshold = 0.5;
        private Duration unitTimeout = Duration.ofMinutes(5);
        private Duration softTimeLimit = Duration.ofMinutes(25);
        private Duration hardTimeLimit = Duration.ofMinutes(30);
        private List<ContentType> enabledTypes = new ArrayList<>(List.of(
                ContentType.TUTORIAL, ContentType.RESOURCE, ContentType.QUIZ));
        private DispatchMode dispatchMode = DispatchMode.BROKER;
    }

    public enum DispatchMode {
        /** Hand the job to the worker pool and park the run until it reports back. */
        BROKER,
        /** Run the job on the calling thread; for local runs without workers. */
        INLINE
    }

    @Data
    public static class Credentials {
        private int minQuota = 4;
    }

    @Data
    public static class Broker {
        /** {@code redis} or {@code memory}. */
        private String type = "redis";
        private Duration pollTimeout = Duration.ofSeconds(2);
        private Duration taskTtl = Duration.ofDays(1);
    }

    @Data
    public static class Worker {
        private boolean enabled = true;
        private int poolSize = 4;
        private long pollDelayMs = 500L;
    }

    @Data
    public static class Agent {
        private LlmProvider provider = LlmProvider.ANTHROPIC;
        // Empty means the provider config's default model
        private String model = "";
        private int maxTokens = 4000;
        private double temperature = 0.2;
        private Duration requestTimeout = Duration.ofSeconds(120);
    }
}
