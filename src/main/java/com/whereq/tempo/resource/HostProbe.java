package com.whereq.tempo.resource;

/**
 * Source of host capacity readings
 */
public interface HostProbe {
    /**
     * Logical CPU cores usable by this process
     */
    int cpuCores();

    /**
     * Memory that can be handed to new work without swapping, in bytes
     */
    long availableMemoryBytes();

    long totalMemoryBytes();

    /**
     * One-minute load average, negative when the platform does not report it
     */
    double systemLoadAverage();
}
