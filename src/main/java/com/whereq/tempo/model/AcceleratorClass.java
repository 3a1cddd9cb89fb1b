package com.whereq.tempo.model;

/**
 * Accelerator available on the host. Only used to let GPU-capable job variants
 * decide whether they may run; the scheduler itself does no GPU work.
 */
public enum AcceleratorClass {
    NONE,
    NVIDIA_CUDA,
    AMD_ROCM;

    public boolean isPresent() {
        return this != NONE;
    }
}
