package com.parley.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A message as kept in the conversation history used to build prompts.
 */
public record ConversationMessage(
    String id,
    String conversationKey,
    String sender,
    String senderName,
    String content,
    Instant timestamp,
    String messageType,
    List<Attachment> attachments,
    QuotedMessage quoted,
    Provenance provenance
) {
    public ConversationMessage {
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
        messageType = messageType != null ? messageType : "text";
        provenance = provenance != null ? provenance : Provenance.USER;
    }
}
