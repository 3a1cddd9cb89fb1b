package com.whereq.tempo.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.whereq.tempo.model.FailureKind;
import com.whereq.tempo.model.FailureRecord;
import com.whereq.tempo.model.Job;
import com.whereq.tempo.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of a job for status queries
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobView {
    private String jobId;

    private JobState state;

    /**
     * True once no further transition can happen automatically
     */
    private boolean terminal;

    private int attemptCount;

    private int maxAttempts;

    private String lastError;

    private FailureKind lastFailureKind;

    private boolean cancelRequested;

    private Instant createdAt;

    private Instant startedAt;

    private Instant finishedAt;

    /**
     * Earliest next attempt of a job waiting out its retry backoff
     */
    private Instant eligibleAt;

    private JsonNode payload;

    private JsonNode result;

    private List<FailureRecord> failures;

    public static JobView from(Job job) {
        Job copy = job.copy();
        return JobView.builder()
            .jobId(copy.getId())
            .state(copy.getState())
            .terminal(copy.getState().isTerminal())
            .attemptCount(copy.getAttemptCount())
            .maxAttempts(copy.getMaxAttempts())
            .lastError(copy.getLastError())
            .lastFailureKind(copy.getLastFailureKind())
            .cancelRequested(copy.isCancelRequested())
            .createdAt(copy.getCreatedAt())
            .startedAt(copy.getStartedAt())
            .finishedAt(copy.getFinishedAt())
            .eligibleAt(copy.getEligibleAt())
            .payload(copy.getPayload())
            .result(copy.getResult())
            .failures(copy.getFailures() != null ? copy.getFailures() : new ArrayList<>())
            .build();
    }
}
