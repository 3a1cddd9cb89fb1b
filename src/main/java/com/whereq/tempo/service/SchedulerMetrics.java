package com.whereq.tempo.service;

import com.whereq.tempo.model.Job;
import com.whereq.tempo.retry.RetryDecision;
import com.whereq.tempo.scheduler.JobEventListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Job outcome metrics
 */
@Slf4j
@Service
public class SchedulerMetrics implements JobEventListener {

    @Autowired
    private MeterRegistry meterRegistry;

    private Counter completedCounter;
    private Counter failedCounter;
    private Counter retriedCounter;
    private Counter cancelledCounter;
    private Timer executionTimer;

    public SchedulerMetrics() {
    }

    SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        initialize();
    }

    @PostConstruct
    public void initialize() {
        completedCounter = Counter.builder("tempo.jobs.completed")
            .description("Number of successfully completed jobs")
            .register(meterRegistry);

        failedCounter = Counter.builder("tempo.jobs.failed")
            .description("Number of jobs that failed permanently")
            .register(meterRegistry);

        retriedCounter = Counter.builder("tempo.jobs.retried")
            .description("Number of retries scheduled after a failed attempt")
            .register(meterRegistry);

        cancelledCounter = Counter.builder("tempo.jobs.cancelled")
            .description("Number of cancelled jobs")
            .register(meterRegistry);

        executionTimer = Timer.builder("tempo.jobs.execution.time")
            .description("Duration of the final attempt of finished jobs")
            .register(meterRegistry);
    }

    @Override
    public void onJobRetryScheduled(Job job, RetryDecision decision) {
        retriedCounter.increment();
    }

    @Override
    public void onJobFinished(Job job, Duration executionTime) {
        switch (job.getState()) {
            case COMPLETED -> completedCounter.increment();
            case FAILED -> failedCounter.increment();
            case CANCELLED -> cancelledCounter.increment();
            default -> log.debug("Ignoring non-terminal job {} in {}", job.getId(), job.getState());
        }
        if (executionTime != null) {
            executionTimer.record(executionTime);
        }
    }
}
