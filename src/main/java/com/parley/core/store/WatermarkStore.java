package com.parley.core.store;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Timestamp of the newest event each conversation has had a reply delivered for.
 * Persisted to {@code router_state.json} so a restart re-covers anything unanswered.
 */
public class WatermarkStore {

    static final String FILE = "router_state.json";

    private final StateFiles files;
    private final Map<String, Instant> watermarks = new ConcurrentHashMap<>();

    public WatermarkStore(StateFiles files) {
        this.files = files;
        var state = files.read(FILE, new TypeReference<Map<String, Map<String, Instant>>>() {}, LinkedHashMap::new);
        var stored = state.get("lastDelivered");
        if (stored != null) {
            watermarks.putAll(stored);
        }
    }

    /** Null when nothing has been delivered yet. */
    public Instant get(String conversationKey) {
        return watermarks.get(conversationKey);
    }

    /** Moves the watermark forward; never backwards. */
    public synchronized void advance(String conversationKey, Instant deliveredUpTo) {
        Instant current = watermarks.get(conversationKey);
        if (current != null && !deliveredUpTo.isAfter(current)) {
            return;
        }
        watermarks.put(conversationKey, deliveredUpTo);
        files.write(FILE, Map.of("lastDelivered", new LinkedHashMap<>(watermarks)));
    }
}
