package com.parley.worker;

/**
 * No worker could serve the request: not running, shutting down, or failed to start.
 */
public class WorkerUnavailableException extends RuntimeException {

    public WorkerUnavailableException(String message) {
        super(message);
    }

    public WorkerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
