package com.learnflow.learnflow_backend.config;

import com.learnflow.learnflow_backend.engine.GraphBuilder;
import com.learnflow.learnflow_backend.engine.NotificationPort;
import com.learnflow.learnflow_backend.engine.TransientRetry;
import com.learnflow.learnflow_backend.engine.WorkflowGraph;
import com.learnflow.learnflow_backend.engine.WorkflowRouter;
import com.learnflow.learnflow_backend.executor.StageExecutor;
import com.learnflow.learnflow_backend.job.ContentGenerationJob;
import com.learnflow.learnflow_backend.job.ContentGeneratorRegistry;
import com.learnflow.learnflow_backend.job.ContentJobSettings;
import com.learnflow.learnflow_backend.job.KeyAllocator;
import com.learnflow.learnflow_backend.repository.WorkflowStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
@EnableConfigurationProperties(LearnflowProperties.class)
public class WorkflowWiring {

    @Bean
    public TransientRetry transientRetry(LearnflowProperties properties) {
        return new TransientRetry(properties.getRetry());
    }

    @Bean
    public ContentJobSettings contentJobSettings(LearnflowProperties properties) {
        return properties.contentJobSettings();
    }

    @Bean
    public WorkflowGraph workflowGraph(List<StageExecutor> executors,
                                       WorkflowRouter router,
                                       LearnflowProperties properties) {
        return GraphBuilder.create()
                .executors(executors)
                .router(router)
                .maxStageExecutions(properties.getWorkflow().getMaxStageExecutions())
                .build();
    }

    @Bean
    public ContentGenerationJob contentGenerationJob(KeyAllocator keyAllocator,
                                                     ContentGeneratorRegistry generators,
                                                     WorkflowStore store,
                                                     NotificationPort notifications,
                                                     TransientRetry transientRetry,
                                                     ContentJobSettings settings) {
        return new ContentGenerationJob(keyAllocator, generators, store, notifications, transientRetry, settings);
    }
}
