package com.parley.worker;

/**
 * A host directory made visible inside a worker container.
 */
public record VolumeMount(
    String hostPath,
    String containerPath,
    boolean readOnly
) {}
