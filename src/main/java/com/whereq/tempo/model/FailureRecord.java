package com.whereq.tempo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One failed attempt in a job's history
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FailureRecord {
    /**
     * Attempt number that failed (1-based)
     */
    private int attempt;

    private FailureKind kind;

    private String message;

    private Instant failedAt;
}
