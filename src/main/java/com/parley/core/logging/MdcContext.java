package com.parley.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Parley-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setConversation(String conversationKey, String namespace) {
        put("conversationKey", conversationKey);
        put("namespace", namespace);
    }

    public static void setRequest(String requestId) {
        put("requestId", requestId);
    }

    public static void setTask(String taskId, String namespace) {
        put("taskId", taskId);
        put("namespace", namespace);
    }

    public static void setSubagent(String subagentId, String conversationKey) {
        put("subagentId", subagentId);
        put("conversationKey", conversationKey);
    }

    public static void clear() {
        MDC.remove("conversationKey");
        MDC.remove("namespace");
        MDC.remove("requestId");
        MDC.remove("taskId");
        MDC.remove("subagentId");
    }

    private static void put(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }
}
