package com.parley.core.model;

import java.time.Instant;

public record QuotedMessage(
    String messageId,
    String senderName,
    String content,
    Instant timestamp
) {}
