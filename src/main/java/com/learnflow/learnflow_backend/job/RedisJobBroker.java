package com.learnflow.learnflow_backend.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis list as the queue, one hash per task for payload and status. Task
 * hashes expire after {@code taskTtl}; an expired handle polls as UNKNOWN.
 */
@Slf4j
public class RedisJobBroker implements JobBroker {

    static final String QUEUE_KEY = "learnflow:content-jobs";
    static final String TASK_PREFIX = "learnflow:task:";
    static final String FIELD_STATUS = "status";
    static final String FIELD_PAYLOAD = "payload";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Duration taskTtl;

    public RedisJobBroker(StringRedisTemplate redis, ObjectMapper objectMapper, Duration taskTtl) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.taskTtl = taskTtl;
    }

    @Override
    public String enqueue(ContentJobPayload payload) {
        String handle = UUID.randomUUID().toString();
        String taskKey = taskKey(handle);
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialise payload of job " + payload.getJobId(), e);
        }
        redis.opsForHash().putAll(taskKey, Map.of(
                FIELD_STATUS, BrokerTaskStatus.PENDING.name(),
                FIELD_PAYLOAD, json));
        redis.expire(taskKey, taskTtl);
        redis.opsForList().leftPush(QUEUE_KEY, handle);
        log.info("[BROKER] enqueued handle={} jobId={} queue={}", handle, payload.getJobId(), QUEUE_KEY);
        return handle;
    }

    @Override
    public BrokerTaskStatus poll(String handle) {
        Object raw = redis.opsForHash().get(taskKey(handle), FIELD_STATUS);
        if (raw == null) {
            return BrokerTaskStatus.UNKNOWN;
        }
        try {
            return BrokerTaskStatus.valueOf(raw.toString());
        } catch (IllegalArgumentException e) {
            log.warn("[BROKER] handle={} has unreadable status '{}'", handle, raw);
            return BrokerTaskStatus.UNKNOWN;
        }
    }

    @Override
    public void revoke(String handle) {
        BrokerTaskStatus current = poll(handle);
        if (current == BrokerTaskStatus.UNKNOWN || current.isFinished()) {
            log.info("[BROKER] revoke ignored for handle={} status={}", handle, current);
            return;
        }
        redis.opsForHash().put(taskKey(handle), FIELD_STATUS, BrokerTaskStatus.REVOKED.name());
        log.info("[BROKER] revoked handle={}", handle);
    }

    @Override
    public Optional<BrokerTask> take(Duration timeout) {
        String handle = redis.opsForList().rightPop(QUEUE_KEY, timeout);
        if (handle == null) {
            return Optional.empty();
        }
        if (poll(handle) != BrokerTaskStatus.PENDING) {
            log.info("[BROKER] skipping handle={} status={}", handle, poll(handle));
            return Optional.empty();
        }
        Object json = redis.opsForHash().get(taskKey(handle), FIELD_PAYLOAD);
        if (json == null) {
            log.warn("[BROKER] handle={} expired before a worker took it", handle);
            return Optional.empty();
        }
        try {
            ContentJobPayload payload = objectMapper.readValue(json.toString(), ContentJobPayload.class);
            redis.opsForHash().put(taskKey(handle), FIELD_STATUS, BrokerTaskStatus.STARTED.name());
            return Optional.of(new BrokerTask(handle, payload));
        } catch (JsonProcessingException e) {
            log.error("[BROKER] handle={} has an unreadable payload: {}", handle, e.getMessage());
            redis.opsForHash().put(taskKey(handle), FIELD_STATUS, BrokerTaskStatus.FAILURE.name());
            return Optional.empty();
        }
    }

    @Override
    public void acknowledge(String handle, BrokerTaskStatus status) {
        if (poll(handle) == BrokerTaskStatus.REVOKED) {
            return;
        }
        redis.opsForHash().put(taskKey(handle), FIELD_STATUS, status.name());
    }

    private static String taskKey(String handle) {
        return TASK_PREFIX + handle;
    }
}
