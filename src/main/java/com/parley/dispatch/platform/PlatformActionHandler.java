package com.parley.dispatch.platform;

import com.parley.core.action.ActionChannel;
import com.parley.core.action.OutboundAction;
import com.parley.core.config.ParleyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Executes the platform-facing outbound actions against the configured {@link PlatformAdapter}.
 */
@Component
public class PlatformActionHandler {

    private static final Logger log = LoggerFactory.getLogger(PlatformActionHandler.class);

    static final int MAX_MESSAGE_LENGTH = 4096;

    private final PlatformAdapter adapter;
    private final String assistantName;

    public PlatformActionHandler(PlatformAdapter adapter, ActionChannel actions, ParleyProperties properties) {
        this.adapter = adapter;
        this.assistantName = properties.getAssistantName();
        actions.subscribe(this::handle);
    }

    void handle(OutboundAction action) {
        if (action instanceof OutboundAction.SendMessage send) {
            send(send.conversationKey(), send.text());
        } else if (action instanceof OutboundAction.SubagentResult result) {
            send(result.conversationKey(), assistantName + ": " + result.text());
        } else if (action instanceof OutboundAction.TypingStart typing) {
            adapter.setTyping(typing.conversationKey(), true);
        } else if (action instanceof OutboundAction.TypingStop typing) {
            adapter.setTyping(typing.conversationKey(), false);
        }
    }

    private void send(String conversationKey, String text) {
        var chunks = chunk(text, MAX_MESSAGE_LENGTH);
        if (chunks.size() > 1) {
            log.debug("Splitting {} chars into {} messages for {}", text.length(), chunks.size(), conversationKey);
        }
        for (String chunk : chunks) {
            adapter.sendMessage(conversationKey, chunk);
        }
    }

    /**
     * Splits {@code text} into pieces of at most {@code limit} chars, preferring the last
     * newline in the second half of each window.
     */
    static List<String> chunk(String text, int limit) {
        List<String> chunks = new ArrayList<>();
        String remaining = text;
        while (remaining.length() > limit) {
            int cut = remaining.lastIndexOf('\n', limit - 1);
            if (cut < limit / 2) {
                cut = limit;
                chunks.add(remaining.substring(0, cut));
                remaining = remaining.substring(cut);
            } else {
                chunks.add(remaining.substring(0, cut));
                remaining = remaining.substring(cut + 1);
            }
        }
        if (!remaining.isEmpty() || chunks.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }
}
