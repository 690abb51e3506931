package com.parley.core.router;

import com.parley.core.concurrent.CancellationToken;
import com.parley.core.model.InboundEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * The batch currently in flight for one conversation. Replaced, never edited, when a merge
 * supersedes it; only the follow-up list grows in place. Loop thread only.
 */
final class ActiveConversationRequest {

    private final String conversationKey;
    private final List<InboundEvent> events;
    private final CancellationToken token;
    private final Instant startedAt;
    private final List<InboundEvent> followUps = new ArrayList<>();

    ActiveConversationRequest(String conversationKey, List<InboundEvent> events, CancellationToken token,
                              Instant startedAt) {
        this.conversationKey = conversationKey;
        this.events = List.copyOf(events);
        this.token = token;
        this.startedAt = startedAt;
    }

    String conversationKey() { return conversationKey; }
    List<InboundEvent> events() { return events; }
    CancellationToken token() { return token; }
    Instant startedAt() { return startedAt; }

    /** Events that arrived after the merge window closed; they start the next batch. */
    List<InboundEvent> followUps() { return followUps; }

    void addFollowUp(InboundEvent event) {
        followUps.add(event);
    }
}
