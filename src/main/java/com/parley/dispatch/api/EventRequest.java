package com.parley.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.parley.core.model.Attachment;
import com.parley.core.model.QuotedMessage;

import java.time.Instant;
import java.util.List;

/**
 * Inbound JSON body for POST /api/v1/events.
 *
 * @param id              platform message id
 * @param conversationKey conversation the message belongs to
 * @param sender          platform sender id
 * @param senderName      display name; nullable, defaults to sender
 * @param content         message text
 * @param timestamp       nullable, defaults to the time of receipt
 * @param messageType     nullable, defaults to "text"
 * @param attachments     nullable
 * @param quoted          nullable
 */
public record EventRequest(
    String id,
    @JsonProperty("conversation_key") String conversationKey,
    String sender,
    @JsonProperty("sender_name") String senderName,
    String content,
    Instant timestamp,
    @JsonProperty("message_type") String messageType,
    List<Attachment> attachments,
    QuotedMessage quoted
) {}
