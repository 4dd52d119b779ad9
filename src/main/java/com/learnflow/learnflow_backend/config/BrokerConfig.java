package com.learnflow.learnflow_backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.job.InMemoryJobBroker;
import com.learnflow.learnflow_backend.job.JobBroker;
import com.learnflow.learnflow_backend.job.RedisJobBroker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

@Slf4j
@Configuration
public class BrokerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "learnflow.broker", name = "type", havingValue = "redis", matchIfMissing = true)
    public JobBroker redisJobBroker(StringRedisTemplate redisTemplate,
                                    ObjectMapper objectMapper,
                                    LearnflowProperties properties) {
        log.info("[BROKER] using Redis job queue");
        return new RedisJobBroker(redisTemplate, objectMapper, properties.getBroker().getTaskTtl());
    }

    @Bean
    @ConditionalOnProperty(prefix = "learnflow.broker", name = "type", havingValue = "memory")
    public JobBroker inMemoryJobBroker() {
        log.warn("[BROKER] using in-memory job queue: queued jobs are lost on restart");
        return new InMemoryJobBroker();
    }
}
