package com.parley.core.model;

import java.time.Instant;

/**
 * Record of one scheduled-task execution, written whether it succeeded or not.
 */
public record TaskRunLog(
    String taskId,
    Instant runAt,
    long durationMs,
    String status,
    String result,
    String error
) {
    public static TaskRunLog success(String taskId, Instant runAt, long durationMs, String result) {
        return new TaskRunLog(taskId, runAt, durationMs, "success", result, null);
    }

    public static TaskRunLog failure(String taskId, Instant runAt, long durationMs, String error) {
        return new TaskRunLog(taskId, runAt, durationMs, "error", null, error);
    }
}
