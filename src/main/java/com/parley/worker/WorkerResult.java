package com.parley.worker;

import com.parley.core.protocol.WireResponse;

/**
 * Outcome of one worker query.
 *
 * @param status       "success" or "error"
 * @param result       agent output, may be null
 * @param newSessionId session to persist for the namespace, may be null
 * @param error        error text, null on success
 */
public record WorkerResult(
    String status,
    String result,
    String newSessionId,
    String error
) {
    public static WorkerResult from(WireResponse response) {
        return new WorkerResult(response.status(), response.result(), response.newSessionId(), response.error());
    }

    public static WorkerResult success(String result, String newSessionId) {
        return new WorkerResult(WireResponse.SUCCESS, result, newSessionId, null);
    }

    public static WorkerResult error(String error) {
        return new WorkerResult(WireResponse.ERROR, null, null, error);
    }

    public boolean isSuccess() {
        return WireResponse.SUCCESS.equals(status);
    }

    public boolean hasResult() {
        return result != null && !result.isBlank();
    }
}
