package com.whereq.tempo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Summary of a drained run. Failed jobs are part of a successful run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchReport {
    private int totalJobs;
    private int completedJobs;
    private int failedJobs;
    private int cancelledJobs;

    /**
     * Wall time since the scheduler started
     */
    private Duration elapsed;

    /**
     * Mean duration of finished executions in this run
     */
    private Duration averageJobDuration;

    /**
     * Finished jobs per second
     */
    private double throughput;

    /**
     * Highest number of jobs observed running at once
     */
    private int peakRunning;
}
