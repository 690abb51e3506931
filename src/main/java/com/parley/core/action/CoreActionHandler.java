package com.parley.core.action;

import com.parley.core.config.ParleyProperties;
import com.parley.core.model.ConversationMessage;
import com.parley.core.model.Provenance;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.store.MessageStore;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.Clock;
import java.util.List;

/**
 * Applies the actions that change orchestrator state rather than the chat platform:
 * session updates, namespace registration, and recording subagent results in history.
 */
public class CoreActionHandler {

    private static final Logger log = LoggerFactory.getLogger(CoreActionHandler.class);

    static final String SUBAGENT_SENDER = "parley-subagent";
    static final String SUBAGENT_SENDER_NAME = "[Subagent]";
    static final String ASSISTANT_SENDER = "parley-assistant";

    private final NamespaceRegistry namespaces;
    private final SessionRegistry sessions;
    private final MessageStore messages;
    private final ParleyProperties properties;
    private final Clock clock;

    public CoreActionHandler(NamespaceRegistry namespaces, SessionRegistry sessions, MessageStore messages,
                             ParleyProperties properties, Clock clock) {
        this.namespaces = namespaces;
        this.sessions = sessions;
        this.messages = messages;
        this.properties = properties;
        this.clock = clock;
    }

    public void handle(OutboundAction action) {
        if (action instanceof OutboundAction.UpdateSession update) {
            sessions.update(update.namespace(), update.sessionId());
        } else if (action instanceof OutboundAction.RegisterNamespace register) {
            register(register);
        } else if (action instanceof OutboundAction.SubagentResult result) {
            record(result);
        } else if (action instanceof OutboundAction.SendMessage send) {
            recordReply(send);
        }
    }

    private void register(OutboundAction.RegisterNamespace action) {
        try {
            Files.createDirectories(properties.groupsPath().resolve(action.folder()).resolve("logs"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create folder for namespace " + action.folder(), e);
        }
        namespaces.register(action.conversationKey(), new RegisteredNamespace(
                action.name(), action.folder(), action.trigger(), clock.instant(), action.containerOptions()));
    }

    /** Replies are kept for the record but never fed back into prompts. */
    private void recordReply(OutboundAction.SendMessage send) {
        var now = clock.instant();
        messages.save(new ConversationMessage("reply-" + now.toEpochMilli() + "-" + Integer.toHexString(send.hashCode()),
                send.conversationKey(), ASSISTANT_SENDER, properties.getAssistantName(), send.text(), now, "text",
                List.of(), null, Provenance.ASSISTANT));
    }

    /** Stored with subagent provenance so later prompts include it without it triggering a turn. */
    private void record(OutboundAction.SubagentResult result) {
        var now = clock.instant();
        var message = new ConversationMessage("subagent-" + now.toEpochMilli() + "-" + Integer.toHexString(result.hashCode()),
                result.conversationKey(), SUBAGENT_SENDER, SUBAGENT_SENDER_NAME,
                "[Task: " + result.task() + "]\n" + result.text(), now, "text", List.of(), null,
                Provenance.SUBAGENT);
        messages.save(message);
        log.debug("Recorded subagent result for {}", result.conversationKey());
    }
}
