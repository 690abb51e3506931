package com.parley.core.store;

import com.parley.core.model.ConversationMessage;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Conversation history used to build prompts.
 */
public interface MessageStore {

    /**
     * Stores a message. Returns false if a message with the same id already exists in the conversation.
     */
    boolean save(ConversationMessage message);

    /**
     * Messages strictly after {@code since} (everything when null), oldest first.
     * Assistant replies are excluded so the agent never sees its own output as input.
     */
    List<ConversationMessage> messagesSince(String conversationKey, Instant since);

    /**
     * The newest messages after {@code since}, at most {@code limit}, oldest first.
     */
    default List<ConversationMessage> recent(String conversationKey, Instant since, int limit) {
        var all = messagesSince(conversationKey, since);
        return all.size() <= limit ? all : all.subList(all.size() - limit, all.size());
    }

    Set<String> conversationKeys();
}
