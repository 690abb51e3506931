package com.parley.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for conversation routing and worker supervision.
 */
@Service
public class ParleyMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeEphemeralWorkers = new AtomicInteger();
    private final AtomicInteger activeSubagents = new AtomicInteger();

    public ParleyMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("parley.workers.active", activeEphemeralWorkers, AtomicInteger::get)
                .description("Running one-shot workers")
                .register(registry);
        Gauge.builder("parley.subagents.active", activeSubagents, AtomicInteger::get)
                .description("Running subagents")
                .register(registry);
    }

    /**
     * @param route   "persistent", "ephemeral" or "fallback"
     * @param outcome "success", "error" or "cancelled"
     */
    public void recordDispatch(String route, String outcome, long ms) {
        Timer.builder("parley.dispatch.duration")
                .tag("route", route)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordMerge() {
        Counter.builder("parley.router.merges")
                .description("Batches superseded by a follow-up inside the merge window")
                .register(registry)
                .increment();
    }

    public void recordWorkerRestart(int attempt) {
        Counter.builder("parley.persistent.restarts")
                .tag("attempt", String.valueOf(attempt))
                .register(registry)
                .increment();
    }

    public void recordPersistentFallback() {
        Counter.builder("parley.persistent.fallback")
                .description("Times the persistent worker gave up and routing fell back to one-shot workers")
                .register(registry)
                .increment();
    }

    public void recordRequestTimeout(String route) {
        Counter.builder("parley.requests.timeouts")
                .tag("route", route)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "applied", "unauthorized", "invalid" or "rejected"
     */
    public void recordMailboxCommand(String type, String outcome) {
        Counter.builder("parley.mailbox.commands")
                .tag("type", type)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordQuarantine(String sourceNamespace) {
        Counter.builder("parley.mailbox.quarantined")
                .tag("namespace", sourceNamespace)
                .register(registry)
                .increment();
    }

    public void recordScheduledRun(String status, long ms) {
        Timer.builder("parley.scheduler.runs")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSubagentAdmission(boolean admitted) {
        Counter.builder("parley.subagents.admissions")
                .tag("result", admitted ? "admitted" : "rejected")
                .register(registry)
                .increment();
    }

    public void workerStarted() {
        activeEphemeralWorkers.incrementAndGet();
    }

    public void workerFinished() {
        activeEphemeralWorkers.decrementAndGet();
    }

    public void setActiveSubagents(int count) {
        activeSubagents.set(count);
    }
}
