package com.whereq.tempo.dto;

import com.whereq.tempo.model.JobState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job enqueue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnqueueResponse {
    private String jobId;

    private JobState state;

    private Instant enqueuedAt;

    /**
     * Error message (if the job was not accepted)
     */
    private String errorMessage;

    public static EnqueueResponse error(String message) {
        return EnqueueResponse.builder()
            .errorMessage(message)
            .enqueuedAt(Instant.now())
            .build();
    }
}
