package com.parley.core.model;

import java.time.Instant;

/**
 * A recurring or one-shot prompt owned by a namespace.
 *
 * @param id              task id
 * @param ownerNamespace  folder of the namespace that created it; checked on every mutation
 * @param conversationKey conversation resolved from the registry at creation time
 * @param prompt          the prompt to run
 * @param scheduleType    cron, interval or once
 * @param scheduleValue   cron expression, interval in ms, or timestamp
 * @param contextMode     shared or isolated session
 * @param nextRun         next due time; null once completed
 * @param lastRun         last run start, may be null
 * @param lastResult      summary of the last run, may be null
 * @param status          active, paused or completed
 * @param createdAt       creation time
 */
public record ScheduledTask(
    String id,
    String ownerNamespace,
    String conversationKey,
    String prompt,
    ScheduleType scheduleType,
    String scheduleValue,
    ContextMode contextMode,
    Instant nextRun,
    Instant lastRun,
    String lastResult,
    TaskStatus status,
    Instant createdAt
) {

    public ScheduledTask withStatus(TaskStatus newStatus) {
        return new ScheduledTask(id, ownerNamespace, conversationKey, prompt, scheduleType, scheduleValue,
                contextMode, nextRun, lastRun, lastResult, newStatus, createdAt);
    }

    /**
     * Applies the outcome of a run. A null {@code newNextRun} completes the task.
     */
    public ScheduledTask afterRun(Instant newNextRun, Instant runAt, String resultSummary) {
        return new ScheduledTask(id, ownerNamespace, conversationKey, prompt, scheduleType, scheduleValue,
                contextMode, newNextRun, runAt, resultSummary,
                newNextRun == null ? TaskStatus.COMPLETED : status, createdAt);
    }

    public boolean isDue(Instant now) {
        return status == TaskStatus.ACTIVE && nextRun != null && !nextRun.isAfter(now);
    }
}
