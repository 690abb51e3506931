package com.parley.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether a scheduled task resumes its namespace's agent session or starts a fresh one.
 */
public enum ContextMode {
    @JsonProperty("shared") SHARED,
    @JsonProperty("isolated") ISOLATED;

    /** Lenient parse; "group" is accepted as a synonym for shared, anything else is isolated. */
    public static ContextMode parse(String value) {
        if (value == null) return ISOLATED;
        return switch (value.trim().toLowerCase()) {
            case "shared", "group" -> SHARED;
            default -> ISOLATED;
        };
    }
}
