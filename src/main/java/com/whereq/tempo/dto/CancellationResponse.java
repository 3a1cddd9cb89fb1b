package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CancellationResponse {
    /**
     * Job identifier, null for a cancel-all request
     */
    private String jobId;

    /**
     * Job state after the request (RUNNING jobs stop asynchronously)
     */
    private JobState state;

    /**
     * False when the job was already terminal and nothing changed
     */
    private boolean accepted;

    /**
     * Jobs affected by a cancel-all request
     */
    private int affectedJobs;

    private Instant requestedAt;

    private String message;
}
