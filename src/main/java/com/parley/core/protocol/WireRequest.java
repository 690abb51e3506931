package com.parley.core.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One request written to a worker's standard input.
 *
 * <p>The persistent worker reads these as newline-delimited JSON; an ephemeral worker
 * receives exactly one followed by end of input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireRequest(
    String requestId,
    String command,
    String prompt,
    String sessionId,
    String namespace,
    String conversationKey,
    Boolean privileged,
    @JsonProperty("isScheduledTask") Boolean scheduledTask
) {
    public static final String QUERY = "query";
    public static final String HEALTH = "health";
    public static final String SHUTDOWN = "shutdown";

    public static WireRequest query(String requestId, String prompt, String sessionId,
                                    String namespace, String conversationKey, boolean privileged) {
        return new WireRequest(requestId, QUERY, prompt, sessionId, namespace, conversationKey, privileged, null);
    }

    public static WireRequest scheduled(String requestId, String prompt, String sessionId,
                                        String namespace, String conversationKey, boolean privileged) {
        return new WireRequest(requestId, QUERY, prompt, sessionId, namespace, conversationKey, privileged, true);
    }

    public static WireRequest health(String requestId) {
        return new WireRequest(requestId, HEALTH, null, null, null, null, null, null);
    }

    public static WireRequest shutdown() {
        return new WireRequest("shutdown", SHUTDOWN, null, null, null, null, null, null);
    }
}
