package com.parley.core.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A worker's reply, correlated to its request by {@code requestId}.
 *
 * @param requestId    id of the request being answered
 * @param status       "success" or "error"
 * @param result       agent output, may be null even on success
 * @param newSessionId session to resume next time, may be null
 * @param error        error text when status is "error"
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record WireResponse(
    String requestId,
    String status,
    String result,
    String newSessionId,
    String error
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
