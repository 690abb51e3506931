package com.parley.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A conversational event delivered by the chat-platform adapter.
 *
 * @param id              platform message id, unique per conversation
 * @param conversationKey the conversation this event belongs to
 * @param sender          platform sender id
 * @param senderName      display name used in prompts
 * @param content         text content (caption for media)
 * @param timestamp       when the platform received it
 * @param messageType     "text", "photo", ... ; defaults to "text"
 * @param attachments     downloaded media, never null
 * @param quoted          message this one replies to, may be null
 */
public record InboundEvent(
    String id,
    String conversationKey,
    String sender,
    String senderName,
    String content,
    Instant timestamp,
    String messageType,
    List<Attachment> attachments,
    QuotedMessage quoted
) {
    public InboundEvent {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id is required");
        if (conversationKey == null || conversationKey.isBlank()) {
            throw new IllegalArgumentException("conversationKey is required");
        }
        if (timestamp == null) throw new IllegalArgumentException("timestamp is required");
        content = content != null ? content : "";
        messageType = messageType != null ? messageType : "text";
        attachments = attachments != null ? List.copyOf(attachments) : List.of();
        senderName = senderName != null ? senderName : sender;
    }

    public static InboundEvent text(String id, String conversationKey, String sender, String content, Instant timestamp) {
        return new InboundEvent(id, conversationKey, sender, sender, content, timestamp, "text", List.of(), null);
    }

    public ConversationMessage toMessage() {
        return new ConversationMessage(id, conversationKey, sender, senderName, content, timestamp,
                messageType, attachments, quoted, Provenance.USER);
    }
}
