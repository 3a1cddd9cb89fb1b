package com.whereq.tempo.retry;

import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of consulting the retry policy for a failed attempt
 */
@Value
public class RetryDecision {
    boolean retry;

    /**
     * Delay before the job may be admitted again; zero when not retried
     */
    Duration backoff;

    /**
     * Earliest admission instant; null when not retried
     */
    Instant eligibleAt;

    public static RetryDecision giveUp() {
        return new RetryDecision(false, Duration.ZERO, null);
    }

    public static RetryDecision retryAt(Duration backoff, Instant eligibleAt) {
        return new RetryDecision(true, backoff, eligibleAt);
    }
}
