package com.whereq.tempo.retry;

import com.whereq.tempo.config.TempoProperties;
import com.whereq.tempo.model.FailureKind;
import com.whereq.tempo.model.Job;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private static final Instant FAILED_AT = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant CHECKED_AT = FAILED_AT.plusSeconds(5);

    private TempoProperties properties;
    private RetryPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new TempoProperties();
        properties.getRetry().setBaseBackoff(Duration.ofSeconds(1));
        properties.getRetry().setBackoffMultiplier(2.0);
        properties.getRetry().setMaxBackoff(Duration.ofSeconds(60));
        properties.getRetry().setJitterRatio(0);
        policy = new RetryPolicy(properties, () -> 0.5);
    }

    @Test
    void testBackoffGrowsExponentially() {
        assertThat(policy.backoff(job(1, 5))).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoff(job(2, 5))).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.backoff(job(3, 5))).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.backoff(job(4, 5))).isEqualTo(Duration.ofSeconds(8));
    }

    @Test
    void testBackoffIsCapped() {
        assertThat(policy.backoff(job(20, 30))).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void testJitterStaysWithinRatio() {
        properties.getRetry().setJitterRatio(0.2);

        assertThat(new RetryPolicy(properties, () -> 0.0).backoff(job(3, 5))).isEqualTo(Duration.ofMillis(3200));
        assertThat(new RetryPolicy(properties, () -> 0.999999).backoff(job(3, 5)).toMillis()).isBetween(4790L, 4800L);
        assertThat(new RetryPolicy(properties, () -> 0.5).backoff(job(3, 5))).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    void testTransientFailureIsRetriedWhileAttemptsRemain() {
        Job job = job(1, 3);
        policy.recordFailure(job, FailureKind.TRANSIENT, "rate limited", FAILED_AT);

        RetryDecision decision = policy.decide(job, FAILED_AT, CHECKED_AT);

        assertThat(decision.isRetry()).isTrue();
        assertThat(decision.getEligibleAt()).isEqualTo(FAILED_AT.plusSeconds(1));
        assertThat(job.getLastError()).isEqualTo("rate limited");
        assertThat(job.getFailures()).hasSize(1);
        assertThat(job.getFailures().get(0).getAttempt()).isEqualTo(1);
    }

    @Test
    void testNoRetryWhenAttemptsExhausted() {
        Job job = job(3, 3);
        policy.recordFailure(job, FailureKind.TRANSIENT, "still down", FAILED_AT);

        RetryDecision decision = policy.decide(job, FAILED_AT, CHECKED_AT);

        assertThat(decision.isRetry()).isFalse();
        assertThat(decision.getEligibleAt()).isNull();
        assertThat(job.getLastError()).isEqualTo("still down");
    }

    @Test
    void testPermanentAndCancelledFailuresAreNeverRetried() {
        Job permanent = job(1, 3);
        policy.recordFailure(permanent, FailureKind.PERMANENT, "bad payload", FAILED_AT);
        Job cancelled = job(1, 3);
        policy.recordFailure(cancelled, FailureKind.CANCELLED, "stopped", FAILED_AT);

        assertThat(policy.decide(permanent, FAILED_AT, CHECKED_AT).isRetry()).isFalse();
        assertThat(policy.decide(cancelled, FAILED_AT, CHECKED_AT).isRetry()).isFalse();
    }

    @Test
    void testTimeoutRetryFollowsJobThenGlobalSetting() {
        Job job = job(1, 3);

        assertThat(policy.isRetryable(job, FailureKind.TIMEOUT)).isTrue();

        properties.getRetry().setTimeoutRetryable(false);
        assertThat(policy.isRetryable(job, FailureKind.TIMEOUT)).isFalse();

        job.setRetryOnTimeout(true);
        assertThat(policy.isRetryable(job, FailureKind.TIMEOUT)).isTrue();

        properties.getRetry().setTimeoutRetryable(true);
        job.setRetryOnTimeout(false);
        assertThat(policy.isRetryable(job, FailureKind.TIMEOUT)).isFalse();
    }

    @Test
    void testInterruptedAttemptsAreRetryable() {
        assertThat(policy.isRetryable(job(1, 3), FailureKind.INTERRUPTED)).isTrue();
    }

    @Test
    void testDisabledRetryGivesUp() {
        properties.getRetry().setEnabled(false);
        Job job = job(1, 3);
        policy.recordFailure(job, FailureKind.TRANSIENT, "flaky", FAILED_AT);

        assertThat(policy.decide(job, FAILED_AT, CHECKED_AT).isRetry()).isFalse();
    }

    @Test
    void testBackoffBasisSelectsReferenceInstant() {
        Job job = job(1, 3);
        policy.recordFailure(job, FailureKind.TRANSIENT, "flaky", FAILED_AT);

        properties.getRetry().setBackoffBasis(TempoProperties.BackoffBasis.ELIGIBILITY_CHECK);

        assertThat(policy.decide(job, FAILED_AT, CHECKED_AT).getEligibleAt()).isEqualTo(CHECKED_AT.plusSeconds(1));
    }

    private static Job job(int attemptCount, int maxAttempts) {
        return Job.builder()
            .id("job-" + attemptCount)
            .attemptCount(attemptCount)
            .maxAttempts(maxAttempts)
            .createdAt(FAILED_AT)
            .build();
    }
}
