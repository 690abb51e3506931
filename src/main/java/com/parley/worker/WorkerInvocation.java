package com.parley.worker;

import com.parley.core.model.RegisteredNamespace;

/**
 * One request for an ephemeral worker.
 *
 * @param namespace       namespace whose mount contract the worker gets
 * @param conversationKey conversation the work is for
 * @param prompt          rendered prompt
 * @param sessionId       session to resume, null for a fresh one
 * @param privileged      whether the privileged mount contract and tools apply
 * @param scheduled       true when started by the scheduler rather than a live turn
 * @param label           short tag used in the container name, e.g. "chat", "sub", "task"
 */
public record WorkerInvocation(
    RegisteredNamespace namespace,
    String conversationKey,
    String prompt,
    String sessionId,
    boolean privileged,
    boolean scheduled,
    String label
) {}
