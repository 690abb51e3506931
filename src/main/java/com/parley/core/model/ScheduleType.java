package com.parley.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScheduleType {
    @JsonProperty("cron") CRON,
    @JsonProperty("interval") INTERVAL,
    @JsonProperty("once") ONCE;

    public static ScheduleType parse(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase()) {
            case "cron" -> CRON;
            case "interval" -> INTERVAL;
            case "once" -> ONCE;
            default -> null;
        };
    }
}
