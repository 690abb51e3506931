package com.parley.core.concurrent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CancellationTokenTest {

    @Test
    @DisplayName("callbacks run once when cancelled")
    void callbacksRunOnce() {
        var token = new CancellationToken();
        List<String> calls = new ArrayList<>();
        token.onCancel(() -> calls.add("a"));
        token.onCancel(() -> calls.add("b"));

        token.cancel();
        token.cancel();

        assertTrue(token.isCancelled());
        assertEquals(List.of("a", "b"), calls);
    }

    @Test
    @DisplayName("callback registered after cancellation runs immediately")
    void lateCallbackRunsImmediately() {
        var token = new CancellationToken();
        token.cancel();
        List<String> calls = new ArrayList<>();

        token.onCancel(() -> calls.add("late"));

        assertEquals(List.of("late"), calls);
    }

    @Test
    @DisplayName("a failing callback does not stop the others")
    void failingCallbackIsIsolated() {
        var token = new CancellationToken();
        List<String> calls = new ArrayList<>();
        token.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        token.onCancel(() -> calls.add("after"));

        token.cancel();

        assertEquals(List.of("after"), calls);
    }
}
