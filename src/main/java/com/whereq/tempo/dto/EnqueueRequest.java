package com.whereq.tempo.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to add a job to the queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueRequest {
    /**
     * Caller-chosen job id; generated when absent
     */
    @Pattern(regexp = "[A-Za-z0-9._:-]{1,128}", message = "jobId may only contain letters, digits and . _ : -")
    private String jobId;

    /**
     * Opaque input for the job runner (script reference, output destination, ...)
     */
    @NotNull
    private JsonNode payload;

    /**
     * Attempt ceiling; the configured default when absent
     */
    @Min(1)
    private Integer maxAttempts;

    /**
     * Whether a timeout may be retried; the configured default when absent.
     * Set to false for jobs that are not idempotent.
     */
    private Boolean retryOnTimeout;
}
