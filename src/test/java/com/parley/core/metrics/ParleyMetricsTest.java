package com.parley.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParleyMetricsTest {

    private SimpleMeterRegistry registry;
    private ParleyMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ParleyMetrics(registry);
    }

    @Test
    @DisplayName("recordDispatch records by route and outcome")
    void recordDispatch() {
        metrics.recordDispatch("persistent", "success", 120);
        metrics.recordDispatch("fallback", "error", 80);

        var persistent = registry.find("parley.dispatch.duration")
                .tag("route", "persistent").tag("outcome", "success").timer();
        var fallback = registry.find("parley.dispatch.duration")
                .tag("route", "fallback").tag("outcome", "error").timer();

        assertNotNull(persistent);
        assertNotNull(fallback);
        assertEquals(1, persistent.count());
        assertEquals(1, fallback.count());
    }

    @Test
    @DisplayName("recordMailboxCommand counts by type and outcome")
    void recordMailboxCommand() {
        metrics.recordMailboxCommand("message", "applied");
        metrics.recordMailboxCommand("message", "applied");
        metrics.recordMailboxCommand("message", "unauthorized");

        var applied = registry.find("parley.mailbox.commands")
                .tag("type", "message").tag("outcome", "applied").counter();
        var blocked = registry.find("parley.mailbox.commands")
                .tag("type", "message").tag("outcome", "unauthorized").counter();

        assertNotNull(applied);
        assertNotNull(blocked);
        assertEquals(2.0, applied.count());
        assertEquals(1.0, blocked.count());
    }

    @Test
    @DisplayName("recordSubagentAdmission separates admitted from rejected")
    void recordSubagentAdmission() {
        metrics.recordSubagentAdmission(true);
        metrics.recordSubagentAdmission(false);

        assertEquals(1.0, registry.find("parley.subagents.admissions").tag("result", "admitted").counter().count());
        assertEquals(1.0, registry.find("parley.subagents.admissions").tag("result", "rejected").counter().count());
    }

    @Test
    @DisplayName("gauges follow active workers and subagents")
    void gauges() {
        metrics.workerStarted();
        metrics.workerStarted();
        metrics.workerFinished();
        metrics.setActiveSubagents(3);

        assertEquals(1.0, registry.find("parley.workers.active").gauge().value());
        assertEquals(3.0, registry.find("parley.subagents.active").gauge().value());
    }

    @Test
    @DisplayName("recordWorkerRestart tags the attempt number")
    void recordWorkerRestart() {
        metrics.recordWorkerRestart(2);

        var counter = registry.find("parley.persistent.restarts").tag("attempt", "2").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }

    @Test
    @DisplayName("recordScheduledRun records to a timer by status")
    void recordScheduledRun() {
        metrics.recordScheduledRun("success", 500);
        metrics.recordScheduledRun("error", 20);

        assertEquals(1, registry.find("parley.scheduler.runs").tag("status", "success").timer().count());
        assertEquals(1, registry.find("parley.scheduler.runs").tag("status", "error").timer().count());
    }
}
