package com.parley.core.store;

import com.parley.core.model.ConversationMessage;
import com.parley.core.model.Provenance;
import com.parley.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.parley.testsupport.TestFixtures.T0;
import static org.junit.jupiter.api.Assertions.*;

class FileMessageStoreTest {

    @TempDir
    Path tmp;

    private StateFiles files;
    private FileMessageStore store;

    @BeforeEach
    void setUp() {
        files = new StateFiles(TestFixtures.objectMapper(), tmp);
        store = new FileMessageStore(files);
    }

    private static ConversationMessage message(String id, String key, Instant at, Provenance provenance) {
        return new ConversationMessage(id, key, "user-1", "Alex", "text " + id, at, null, null, null, provenance);
    }

    @Test
    @DisplayName("messagesSince is strict, ordered by timestamp and excludes assistant replies")
    void messagesSince() {
        store.save(message("c", "chat-a", T0.plusSeconds(3), Provenance.USER));
        store.save(message("a", "chat-a", T0.plusSeconds(1), Provenance.USER));
        store.save(message("r", "chat-a", T0.plusSeconds(2), Provenance.ASSISTANT));
        store.save(message("s", "chat-a", T0.plusSeconds(4), Provenance.SUBAGENT));

        assertEquals(List.of("a", "c", "s"), ids(store.messagesSince("chat-a", null)));
        assertEquals(List.of("c", "s"), ids(store.messagesSince("chat-a", T0.plusSeconds(1))));
    }

    @Test
    @DisplayName("a repeated id is rejected")
    void duplicateIds() {
        assertTrue(store.save(message("a", "chat-a", T0, Provenance.USER)));
        assertFalse(store.save(message("a", "chat-a", T0.plusSeconds(5), Provenance.USER)));

        assertEquals(1, store.messagesSince("chat-a", null).size());
    }

    @Test
    @DisplayName("history survives a restart and conversation keys are discovered from disk")
    void reload() {
        store.save(message("a", "chat:a/1", T0, Provenance.USER));
        store.save(message("b", "chat-b", T0, Provenance.USER));

        var reloaded = new FileMessageStore(files);

        assertEquals(Set.of("chat:a/1", "chat-b"), reloaded.conversationKeys());
        assertEquals(List.of("a"), ids(reloaded.messagesSince("chat:a/1", null)));
        assertFalse(reloaded.save(message("a", "chat:a/1", T0, Provenance.USER)));
    }

    @Test
    @DisplayName("an unreadable journal line is skipped")
    void corruptLine() throws IOException {
        store.save(message("a", "chat-a", T0, Provenance.USER));
        Files.writeString(files.resolve(FileMessageStore.fileName("chat-a")), "{truncated\n",
                StandardOpenOption.APPEND);

        var reloaded = new FileMessageStore(files);

        assertEquals(List.of("a"), ids(reloaded.messagesSince("chat-a", null)));
    }

    @Test
    @DisplayName("recent keeps only the newest messages")
    void recent() {
        for (int i = 0; i < 5; i++) {
            store.save(message("m" + i, "chat-a", T0.plusSeconds(i), Provenance.USER));
        }

        assertEquals(List.of("m3", "m4"), ids(store.recent("chat-a", null, 2)));
    }

    private static List<String> ids(List<ConversationMessage> messages) {
        return messages.stream().map(ConversationMessage::id).toList();
    }
}
