package com.parley.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.parley.core.config.ParleyProperties;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.InboundEvent;
import com.parley.core.model.RegisteredNamespace;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Shared builders for unit tests.
 */
public final class TestFixtures {

    public static final Instant T0 = Instant.parse("2026-03-04T10:00:00Z");

    private TestFixtures() {}

    /** Mapper configured like Spring Boot's: ISO-8601 dates. */
    public static ObjectMapper objectMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    /** Properties with data and group directories under {@code root}. */
    public static ParleyProperties properties(Path root) {
        var properties = new ParleyProperties();
        properties.setDataDir(root.resolve("data").toString());
        properties.setGroupsDir(root.resolve("groups").toString());
        properties.setTimezone("UTC");
        return properties;
    }

    public static ParleyMetrics metrics() {
        return new ParleyMetrics(new SimpleMeterRegistry());
    }

    public static RegisteredNamespace namespace(String folder) {
        return new RegisteredNamespace(folder, folder, "@Parley", T0, null);
    }

    public static InboundEvent event(String id, String conversationKey, String content, Instant at) {
        return InboundEvent.text(id, conversationKey, "user-1", content, at);
    }

    /** The exception a completed future failed with; fails the test if it did not fail. */
    public static Throwable failureOf(CompletableFuture<?> future) {
        if (!future.isCompletedExceptionally()) {
            throw new AssertionError("Expected a failed future but was " + future);
        }
        try {
            future.join();
        } catch (CancellationException e) {
            return e;
        } catch (CompletionException e) {
            return e.getCause();
        }
        throw new AssertionError("Future reported failure but joined normally");
    }
}
