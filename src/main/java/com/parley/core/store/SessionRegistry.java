package com.parley.core.store;

import com.fasterxml.jackson.core.type.TypeReference;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Agent session id per namespace folder, in {@code sessions.json}.
 */
public class SessionRegistry {

    static final String FILE = "sessions.json";

    private final StateFiles files;
    private final Map<String, String> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(StateFiles files) {
        this.files = files;
        sessions.putAll(files.read(FILE, new TypeReference<Map<String, String>>() {}, LinkedHashMap::new));
    }

    public String get(String folder) {
        return sessions.get(folder);
    }

    public synchronized void update(String folder, String sessionId) {
        if (sessionId == null || sessionId.equals(sessions.get(folder))) {
            return;
        }
        sessions.put(folder, sessionId);
        files.write(FILE, new LinkedHashMap<>(sessions));
    }
}
