package com.learnflow.learnflow_backend.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.learnflow.learnflow_backend.model.event.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes run progress on Redis pub/sub so every API instance can relay it
 * to its own subscribers. Without a Redis connection events are only logged.
 */
@Slf4j
@Component
public class ProgressEventPublisher implements NotificationPort {

    public static final String REDIS_CHANNEL = "learnflow:progress";

    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final ObjectMapper objectMapper;

    public ProgressEventPublisher(ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                                  ObjectMapper objectMapper) {
        this.redisTemplateProvider = redisTemplateProvider;
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String runId, ProgressEvent event) {
        try {
            StringRedisTemplate redis = redisTemplateProvider.getIfAvailable();
            log.debug("[PUB/SUB] publish: runId={}, type={}, stage={}, via={}",
                    runId, event.getType(), event.getStage(), redis != null ? "Redis" : "Log");
            if (redis == null) {
                return;
            }
            Map<String, Object> envelope = new LinkedHashMap<>();
            envelope.put("runId", runId);
            envelope.put("event", event);
            redis.convertAndSend(REDIS_CHANNEL, objectMapper.writeValueAsString(envelope));
        } catch (Exception e) {
            log.warn("[PUB/SUB] Dropped {} event for run {}: {}", event.getType(), runId, e.getMessage());
        }
    }
}
