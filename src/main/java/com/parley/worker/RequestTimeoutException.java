package com.parley.worker;

import java.time.Duration;

/**
 * No response arrived within the request timeout. Says nothing about whether the worker is alive.
 */
public class RequestTimeoutException extends RuntimeException {

    public RequestTimeoutException(String requestId, Duration timeout) {
        super("Request " + requestId + " timed out after " + timeout.toMillis() + "ms");
    }
}
