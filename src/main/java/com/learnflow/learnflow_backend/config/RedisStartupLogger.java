package com.learnflow.learnflow_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.stereotype.Component;

/**
 * Logs at startup whether Redis answers. Progress events and the Redis job
 * broker both depend on it.
 */
@Slf4j
@Component
public class RedisStartupLogger implements ApplicationRunner {

    private final ObjectProvider<RedisConnectionFactory> connectionFactory;
    private final LearnflowProperties properties;

    public RedisStartupLogger(ObjectProvider<RedisConnectionFactory> connectionFactory, LearnflowProperties properties) {
        this.connectionFactory = connectionFactory;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        RedisConnectionFactory factory = connectionFactory.getIfAvailable();
        boolean redisBroker = "redis".equalsIgnoreCase(properties.getBroker().getType());
        if (factory == null) {
            log.warn("[PUB/SUB] Redis: no connection factory, progress events are logged only (broker={})",
                    properties.getBroker().getType());
            return;
        }
        try (RedisConnection connection = factory.getConnection()) {
            connection.ping();
            log.info("[PUB/SUB] Redis: connection OK, progress events and broker={} use Redis",
                    properties.getBroker().getType());
        } catch (Exception e) {
            if (redisBroker) {
                log.error("[BROKER] Redis: connection failed, content jobs cannot be queued: {}", e.getMessage());
            } else {
                log.warn("[PUB/SUB] Redis: connection failed, progress events are logged only: {}", e.getMessage());
            }
        }
    }
}
