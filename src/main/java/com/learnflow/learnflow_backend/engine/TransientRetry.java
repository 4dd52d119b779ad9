package com.learnflow.learnflow_backend.engine;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.function.Supplier;

/**
 * Retries broker and storage calls that failed for transient reasons.
 * Anything else (including agent/provider errors) propagates on the first attempt.
 */
@Slf4j
public class TransientRetry {

    private final int maxRetries;
    private final long initialDelayMs;
    private final double multiplier;

    public TransientRetry(RetryConfig config) {
        this.maxRetries = Math.max(0, Math.min(10, config.getMaxRetries()));
        this.initialDelayMs = config.getBackoffMs() > 0 ? config.getBackoffMs() : 200L;
        this.multiplier = config.getBackoffMultiplier() > 0 ? config.getBackoffMultiplier() : 1.0d;
    }

    /** No retries at all; used where a caller wants the plain call semantics. */
    public static TransientRetry none() {
        return new TransientRetry(RetryConfig.of(0, 1L, 1.0d));
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public <T> T call(String operation, Supplier<T> action) {
        long delayMs = initialDelayMs;
        int attempt = 0;

        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (RuntimeException ex) {
                if (!isTransient(ex) || attempt > maxRetries) {
                    if (isTransient(ex)) {
                        log.error("[RETRY] {} failed after {} attempts: {}", operation, attempt, ex.getMessage());
                    }
                    throw ex;
                }
                log.warn("[RETRY] {} failed on attempt {}/{}. Retrying in {} ms: {}",
                        operation, attempt, maxRetries + 1, delayMs, ex.getMessage());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("[RETRY] Backoff interrupted for {}, giving up", operation);
                    throw ex;
                }
                delayMs = (long) Math.max(0L, delayMs * multiplier);
            }
        }
    }

    public static boolean isTransient(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof TransientInfraException
                    || current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof RedisConnectionFailureException) {
                return true;
            }
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return false;
    }
}
