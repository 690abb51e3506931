package com.parley.dispatch.platform;

/**
 * Outbound side of a chat platform. Implementations deliver text and typing indicators
 * to the conversation identified by {@code conversationKey}.
 */
public interface PlatformAdapter {

    void sendMessage(String conversationKey, String text);

    void setTyping(String conversationKey, boolean typing);
}
