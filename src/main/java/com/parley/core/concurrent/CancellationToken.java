package com.parley.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cancellation signal shared between the router and the work it started.
 *
 * <p>Callbacks registered after cancellation run immediately on the registering thread.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) return;
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationToken::runSafely);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runSafely(callback);
    }

    private static void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
