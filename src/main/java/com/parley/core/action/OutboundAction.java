package com.parley.core.action;

import com.parley.core.model.ContainerOptions;

/**
 * Side effects the router asks the outside world to perform.
 *
 * <p>The core never talks to the chat platform directly; it publishes these on the
 * {@link ActionChannel} and the platform layer executes them.
 */
public interface OutboundAction {

    String conversationKey();

    record SendMessage(String conversationKey, String text) implements OutboundAction {}

    record UpdateSession(String conversationKey, String namespace, String sessionId) implements OutboundAction {}

    record TypingStart(String conversationKey) implements OutboundAction {}

    record TypingStop(String conversationKey) implements OutboundAction {}

    /**
     * @param task short description of what the subagent was asked to do
     */
    record SubagentResult(String conversationKey, String text, String task) implements OutboundAction {}

    record RegisterNamespace(String conversationKey, String name, String folder, String trigger,
                             ContainerOptions containerOptions) implements OutboundAction {}
}
