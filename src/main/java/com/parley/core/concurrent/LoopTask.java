package com.parley.core.concurrent;

/**
 * Handle for a delayed or periodic task registered on the {@link OrchestratorLoop}.
 */
public interface LoopTask {

    void cancel();

    boolean isCancelled();
}
