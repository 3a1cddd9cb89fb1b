package com.whereq.tempo.resource;

import com.whereq.tempo.model.AcceleratorClass;

/**
 * Discovers the accelerator class of the host. Discovery is expensive, the
 * resource monitor calls it once and caches the answer.
 */
@FunctionalInterface
public interface AcceleratorProbe {
    AcceleratorClass probe();
}
