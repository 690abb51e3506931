package com.parley.dispatch.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default adapter used when no chat platform is wired in: outbound traffic goes to the log.
 */
public class LoggingPlatformAdapter implements PlatformAdapter {

    private static final Logger log = LoggerFactory.getLogger(LoggingPlatformAdapter.class);

    @Override
    public void sendMessage(String conversationKey, String text) {
        log.info("[{}] {}", conversationKey, text);
    }

    @Override
    public void setTyping(String conversationKey, boolean typing) {
        log.debug("[{}] typing={}", conversationKey, typing);
    }
}
