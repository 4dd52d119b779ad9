package com.learnflow.learnflow_backend.config;

import com.learnflow.learnflow_backend.engine.WorkflowEngine;
import com.learnflow.learnflow_backend.engine.WorkflowErrorHandler;
import com.learnflow.learnflow_backend.job.ContentGenerationJob;
import com.learnflow.learnflow_backend.job.ContentJobWorker;
import com.learnflow.learnflow_backend.job.JobBroker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker side of the deployable. Content jobs run on their own pool, never on
 * the threads that serve start and resume calls.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "learnflow.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkerPoolConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService contentJobExecutor(LearnflowProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.getWorker().getPoolSize()), named("content-job-"));
    }

    // Not a bean: a ScheduledExecutorService bean would take over @Scheduled polling
    @Bean(destroyMethod = "shutdown")
    public ContentJobWorker contentJobWorker(JobBroker broker,
                                             ContentGenerationJob job,
                                             WorkflowEngine engine,
                                             WorkflowErrorHandler errorHandler,
                                             @Qualifier("contentJobExecutor") ExecutorService contentJobExecutor,
                                             LearnflowProperties properties) {
        ScheduledExecutorService watchdog = Executors.newSingleThreadScheduledExecutor(named("content-job-watchdog-"));
        return new ContentJobWorker(broker, job, engine, errorHandler, contentJobExecutor, watchdog, properties);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
