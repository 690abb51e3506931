package com.parley.core.scheduler;

/**
 * A schedule value that cannot be evaluated: bad cron expression, non-positive interval,
 * or unparseable timestamp. Raised at creation time so the task is never stored.
 */
public class SchedulingSpecException extends RuntimeException {

    public SchedulingSpecException(String message) {
        super(message);
    }

    public SchedulingSpecException(String message, Throwable cause) {
        super(message, cause);
    }
}
