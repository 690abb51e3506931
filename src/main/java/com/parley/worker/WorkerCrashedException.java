package com.parley.worker;

/**
 * The worker exited while the request was outstanding.
 */
public class WorkerCrashedException extends RuntimeException {

    public WorkerCrashedException(String message) {
        super(message);
    }
}
