package com.parley.core.model;

import java.util.Map;

/**
 * Per-namespace worker overrides supplied at registration time.
 *
 * @param timeoutMs ephemeral worker timeout override, null for the default
 * @param env       extra environment variables for this namespace's workers
 */
public record ContainerOptions(
    Long timeoutMs,
    Map<String, String> env
) {
    public ContainerOptions {
        env = env != null ? Map.copyOf(env) : Map.of();
    }
}
