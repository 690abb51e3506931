package com.parley.core.engine;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * Starts the orchestrator with the application context and stops it on close.
 * Only active when {@code parley.orchestrator.auto-start} is true, which {@code serve} sets.
 */
@Component
@ConditionalOnProperty(name = "parley.orchestrator.auto-start", havingValue = "true")
public class OrchestratorLifecycle implements SmartLifecycle {

    private final Orchestrator orchestrator;
    private volatile boolean running;

    public OrchestratorLifecycle(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void start() {
        orchestrator.start().join();
        running = true;
    }

    @Override
    public void stop() {
        orchestrator.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
