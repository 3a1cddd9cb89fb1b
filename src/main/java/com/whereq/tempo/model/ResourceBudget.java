package com.whereq.tempo.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time capacity snapshot computed by the resource monitor
 */
@Value
@Builder
public class ResourceBudget {
    /**
     * Upper bound on concurrent jobs, always at least 1
     */
    int maxWorkers;

    AcceleratorClass acceleratorClass;

    int cpuCores;

    long availableMemoryMb;

    long totalMemoryMb;

    int workersByMemory;

    int workersByCpu;

    int hardCap;

    Instant sampledAt;
}
