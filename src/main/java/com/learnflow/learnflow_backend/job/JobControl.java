package com.learnflow.learnflow_backend.job;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * External stop signals for a running job: broker revocation and the soft and
 * hard wall-clock limits. Polled by the job at batch boundaries.
 */
@Slf4j
public class JobControl {

    private final BooleanSupplier revoked;
    private final Instant softDeadline;
    private final Instant hardDeadline;
    private final Clock clock;

    public JobControl(BooleanSupplier revoked, Instant softDeadline, Instant hardDeadline, Clock clock) {
        this.revoked = revoked;
        this.softDeadline = softDeadline;
        this.hardDeadline = hardDeadline;
        this.clock = clock;
    }

    public static JobControl unbounded() {
        return new JobControl(() -> false, Instant.MAX, Instant.MAX, Clock.systemUTC());
    }

    public static JobControl of(BooleanSupplier revoked, Duration softLimit, Duration hardLimit) {
        Clock clock = Clock.systemUTC();
        Instant now = clock.instant();
        return new JobControl(revoked, now.plus(softLimit), now.plus(hardLimit), clock);
    }

    public Optional<StopReason> stopReason() {
        Instant now = clock.instant();
        if (Thread.currentThread().isInterrupted() || !now.isBefore(hardDeadline)) {
            return Optional.of(StopReason.HARD_TIME_LIMIT);
        }
        if (isRevoked()) {
            return Optional.of(StopReason.CANCELLED);
        }
        if (!now.isBefore(softDeadline)) {
            return Optional.of(StopReason.SOFT_TIME_LIMIT);
        }
        return Optional.empty();
    }

    private boolean isRevoked() {
        try {
            return revoked.getAsBoolean();
        } catch (RuntimeException e) {
            // Unknown revocation state; keep going, the next boundary asks again
            log.warn("[CONTENT-JOB] Revocation check failed: {}", e.getMessage());
            return false;
        }
    }
}
