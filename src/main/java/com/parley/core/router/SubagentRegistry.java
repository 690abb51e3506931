package com.parley.core.router;

import com.parley.core.concurrent.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded set of running subagents. The limit is checked and the slot taken in the same call,
 * so admission can never overshoot. Loop thread only.
 */
public class SubagentRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubagentRegistry.class);

    private final int limit;
    private final Map<String, SubagentHandle> active = new LinkedHashMap<>();

    public SubagentRegistry(int limit) {
        this.limit = limit;
    }

    /** Takes a slot for a new subagent, or returns empty when the limit is reached. */
    public Optional<SubagentHandle> tryAdmit(String id, String ownerConversationKey) {
        if (active.size() >= limit) {
            return Optional.empty();
        }
        var handle = new SubagentHandle(id, ownerConversationKey, new CancellationToken());
        active.put(id, handle);
        return Optional.of(handle);
    }

    public void release(String id) {
        active.remove(id);
    }

    /** Cancels and forgets every subagent owned by {@code conversationKey}. Returns how many. */
    public int cancelOwnedBy(String conversationKey) {
        var owned = new ArrayList<SubagentHandle>();
        for (SubagentHandle handle : active.values()) {
            if (handle.ownerConversationKey().equals(conversationKey)) {
                owned.add(handle);
            }
        }
        for (SubagentHandle handle : owned) {
            active.remove(handle.id());
            handle.token().cancel();
            log.info("Cancelled subagent {} of {}", handle.id(), conversationKey);
        }
        return owned.size();
    }

    public void cancelAll() {
        var all = new ArrayList<>(active.values());
        active.clear();
        all.forEach(h -> h.token().cancel());
    }

    public int size() {
        return active.size();
    }

    public int limit() {
        return limit;
    }
}
