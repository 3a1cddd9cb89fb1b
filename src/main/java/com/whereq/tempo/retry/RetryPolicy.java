package com.whereq.tempo.retry;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.FailureKind;
import com.whereq.tempo.model.FailureRecord;
import com.whereq.tempo.model.Job;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decides if and when a failed job re-enters PENDING.
 *
 * Backoff grows exponentially with the attempt count and is spread by a
 * random jitter so jobs that failed together on a shared outage do not
 * come back together.
 */
@Slf4j
public class RetryPolicy {

    private final TempoProperties.RetryConfig config;
    private final DoubleSupplier random;

    public RetryPolicy(TempoProperties properties) {
        this(properties, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1) used for jitter
     */
    public RetryPolicy(TempoProperties properties, DoubleSupplier random) {
        this.config = properties.getRetry();
        this.random = random;
    }

    /**
     * Record a failed attempt on the job: last error and failure history are
     * updated whether or not the job will be retried.
     */
    public void recordFailure(Job job, FailureKind kind, String message, Instant failedAt) {
        if (job.getFailures() == null) {
            job.setFailures(new ArrayList<>());
        }
        job.getFailures().add(FailureRecord.builder()
            .attempt(job.getAttemptCount())
            .kind(kind)
            .message(message)
            .failedAt(failedAt)
            .build());
        job.setLastError(message);
        job.setLastFailureKind(kind);
    }

    /**
     * True iff attempts remain and the last failure is retryable
     */
    public boolean shouldRetry(Job job) {
        if (!config.isEnabled() || !job.hasAttemptsRemaining()) {
            return false;
        }
        return isRetryable(job, job.getLastFailureKind());
    }

    public boolean isRetryable(Job job, FailureKind kind) {
        if (kind == null) {
            return false;
        }
        return switch (kind) {
            case TRANSIENT, INTERRUPTED -> true;
            case TIMEOUT -> job.getRetryOnTimeout() != null ? job.getRetryOnTimeout() : config.isTimeoutRetryable();
            case PERMANENT, CANCELLED -> false;
        };
    }

    /**
     * Delay before the job becomes eligible again: base * multiplier^(attempt - 1),
     * capped, then varied by the jitter ratio
     */
    public Duration backoff(Job job) {
        int exponent = Math.max(0, job.getAttemptCount() - 1);
        double maxMillis = config.getMaxBackoff().toMillis();
        double millis = Math.min(config.getBaseBackoff().toMillis() * Math.pow(config.getBackoffMultiplier(), exponent),
            maxMillis);

        double jitter = millis * config.getJitterRatio() * (2 * random.getAsDouble() - 1);
        long delay = Math.round(Math.min(maxMillis, Math.max(0, millis + jitter)));
        return Duration.ofMillis(delay);
    }

    /**
     * Decide what happens to a job whose failure has been recorded
     *
     * @param job job carrying the recorded failure
     * @param failedAt when the attempt failed
     * @param checkedAt when the scheduler processed the failure
     * @return retry decision
     */
    public RetryDecision decide(Job job, Instant failedAt, Instant checkedAt) {
        if (!shouldRetry(job)) {
            log.debug("Job {} will not be retried (attempt {}/{}, kind {})",
                job.getId(), job.getAttemptCount(), job.getMaxAttempts(), job.getLastFailureKind());
            return RetryDecision.giveUp();
        }

        Duration delay = backoff(job);
        Instant from = config.getBackoffBasis() == TempoProperties.BackoffBasis.FAILURE_TIME ? failedAt : checkedAt;
        return RetryDecision.retryAt(delay, from.plus(delay));
    }
}
