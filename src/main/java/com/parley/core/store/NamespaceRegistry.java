package com.parley.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.parley.core.model.RegisteredNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trusted mapping from conversation key to the namespace that owns it.
 * This, not anything a worker writes, decides which conversation a namespace may address.
 */
public class NamespaceRegistry {

    private static final Logger log = LoggerFactory.getLogger(NamespaceRegistry.class);

    static final String FILE = "registered_namespaces.json";

    private final StateFiles files;
    private final String privilegedFolder;
    private final Map<String, RegisteredNamespace> byConversation = new ConcurrentHashMap<>();

    public NamespaceRegistry(StateFiles files, String privilegedFolder) {
        this.files = files;
        this.privilegedFolder = privilegedFolder;
        byConversation.putAll(files.read(FILE, new TypeReference<Map<String, RegisteredNamespace>>() {},
                LinkedHashMap::new));
        log.info("Loaded {} registered namespace(s)", byConversation.size());
    }

    public Optional<RegisteredNamespace> forConversation(String conversationKey) {
        return Optional.ofNullable(byConversation.get(conversationKey));
    }

    /** Conversation key owned by {@code folder}, if registered. */
    public Optional<String> conversationFor(String folder) {
        return byConversation.entrySet().stream()
                .filter(e -> e.getValue().folder().equals(folder))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public Optional<RegisteredNamespace> byFolder(String folder) {
        return byConversation.values().stream().filter(ns -> ns.folder().equals(folder)).findFirst();
    }

    public boolean isPrivileged(String folder) {
        return privilegedFolder.equals(folder);
    }

    public String privilegedFolder() {
        return privilegedFolder;
    }

    public synchronized void register(String conversationKey, RegisteredNamespace namespace) {
        byConversation.put(conversationKey, namespace);
        files.write(FILE, new LinkedHashMap<>(byConversation));
        log.info("Registered namespace {} ({}) for {}", namespace.name(), namespace.folder(), conversationKey);
    }

    public Map<String, RegisteredNamespace> all() {
        return Map.copyOf(byConversation);
    }
}
