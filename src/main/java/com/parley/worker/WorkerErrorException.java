package com.parley.worker;

/**
 * The worker answered with {@code status: error}, or exited without a readable answer.
 */
public class WorkerErrorException extends RuntimeException {

    public WorkerErrorException(String message) {
        super(message);
    }
}
