package com.parley.core.health;

import java.util.Map;

/**
 * Result of checking one Parley component.
 *
 * <p>{@link Status#DEGRADED} means the component has failed but requests still flow
 * through a fallback, e.g. one-shot workers after the persistent worker exhausts its
 * restart budget. The health endpoint answers 200 for it; only {@link Status#DOWN}
 * turns the response into a 503.
 *
 * @param metadata component-specific string values, never null
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    public enum Status { UP, DOWN, DEGRADED }
}
