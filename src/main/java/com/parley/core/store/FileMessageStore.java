package com.parley.core.store;

import com.parley.core.model.ConversationMessage;
import com.parley.core.model.Provenance;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Message history kept as one JSON-lines journal per conversation under {@code messages/}.
 * Journals are loaded lazily and cached.
 */
public class FileMessageStore implements MessageStore {

    static final String DIRECTORY = "messages";

    private final StateFiles files;
    private final Map<String, List<ConversationMessage>> cache = new HashMap<>();

    public FileMessageStore(StateFiles files) {
        this.files = files;
    }

    @Override
    public synchronized boolean save(ConversationMessage message) {
        var journal = journal(message.conversationKey());
        for (ConversationMessage existing : journal) {
            if (existing.id().equals(message.id())) {
                return false;
            }
        }
        files.append(fileName(message.conversationKey()), message);
        journal.add(message);
        return true;
    }

    @Override
    public synchronized List<ConversationMessage> messagesSince(String conversationKey, Instant since) {
        return journal(conversationKey).stream()
                .filter(m -> m.provenance() != Provenance.ASSISTANT)
                .filter(m -> since == null || m.timestamp().isAfter(since))
                .sorted(Comparator.comparing(ConversationMessage::timestamp))
                .toList();
    }

    @Override
    public synchronized Set<String> conversationKeys() {
        var keys = new LinkedHashSet<>(cache.keySet());
        for (String name : files.list(DIRECTORY, ".jsonl")) {
            var lines = files.readLines(DIRECTORY + "/" + name, ConversationMessage.class);
            if (!lines.isEmpty()) {
                keys.add(lines.get(0).conversationKey());
            }
        }
        return keys;
    }

    private List<ConversationMessage> journal(String conversationKey) {
        return cache.computeIfAbsent(conversationKey,
                k -> new ArrayList<>(files.readLines(fileName(k), ConversationMessage.class)));
    }

    static String fileName(String conversationKey) {
        return DIRECTORY + "/" + conversationKey.replaceAll("[^A-Za-z0-9_.-]", "_") + ".jsonl";
    }
}
