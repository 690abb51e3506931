package com.parley.core.scheduler;

import com.parley.core.concurrent.LoopTask;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.logging.MdcContext;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.ContextMode;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.model.ScheduledTask;
import com.parley.core.model.TaskRunLog;
import com.parley.core.model.TaskStatus;
import com.parley.core.router.RequestRouter;
import com.parley.core.store.NamespaceRegistry;
import com.parley.core.store.SessionRegistry;
import com.parley.core.store.TaskStore;
import com.parley.worker.WorkerResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Polls the task store for due tasks and runs them through the router.
 *
 * <p>Every run is logged whether it succeeds or not, then the task's next run is recomputed;
 * one-shot tasks complete. A task is never started twice concurrently. Loop thread only.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private static final int SUMMARY_LENGTH = 200;

    private final TaskStore tasks;
    private final NamespaceRegistry namespaces;
    private final SessionRegistry sessions;
    private final RequestRouter router;
    private final ScheduleCalculator calculator;
    private final OrchestratorLoop loop;
    private final Duration interval;
    private final Clock clock;
    private final ParleyMetrics metrics;

    private final Set<String> inFlight = new HashSet<>();
    private LoopTask ticker;

    public TaskScheduler(TaskStore tasks, NamespaceRegistry namespaces, SessionRegistry sessions,
                         RequestRouter router, ScheduleCalculator calculator, OrchestratorLoop loop,
                         Duration interval, Clock clock, ParleyMetrics metrics) {
        this.tasks = tasks;
        this.namespaces = namespaces;
        this.sessions = sessions;
        this.router = router;
        this.calculator = calculator;
        this.loop = loop;
        this.interval = interval;
        this.clock = clock;
        this.metrics = metrics;
    }

    public void start() {
        if (ticker != null) {
            log.debug("Scheduler already running, skipping duplicate start");
            return;
        }
        ticker = loop.scheduleAtFixedRate(Duration.ZERO, interval, this::poll);
        log.info("Scheduler started, polling every {}s", interval.toSeconds());
    }

    public void stop() {
        if (ticker != null) {
            ticker.cancel();
            ticker = null;
            log.info("Scheduler stopped");
        }
    }

    public void poll() {
        List<ScheduledTask> due = tasks.due(clock.instant());
        if (!due.isEmpty()) {
            log.info("Found {} due task(s)", due.size());
        }
        for (ScheduledTask candidate : due) {
            if (inFlight.contains(candidate.id())) continue;
            // re-read: a pause or cancel may have landed since the due query
            var current = tasks.get(candidate.id()).orElse(null);
            if (current == null || current.status() != TaskStatus.ACTIVE) continue;
            run(current);
        }
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private void run(ScheduledTask task) {
        Instant startedAt = clock.instant();
        MdcContext.setTask(task.id(), task.ownerNamespace());
        try {
            RegisteredNamespace namespace = namespaces.byFolder(task.ownerNamespace()).orElse(null);
            if (namespace == null) {
                log.error("Namespace {} for task {} is not registered", task.ownerNamespace(), task.id());
                complete(task, startedAt, null, "Namespace not registered: " + task.ownerNamespace());
                return;
            }
            log.info("Running scheduled task {} for {}", task.id(), task.ownerNamespace());
            String sessionId = task.contextMode() == ContextMode.SHARED ? sessions.get(namespace.folder()) : null;
            inFlight.add(task.id());
            CompletableFuture<WorkerResult> run;
            try {
                run = router.dispatchScheduled(namespace, task.conversationKey(), task.prompt(), sessionId);
            } catch (RuntimeException e) {
                run = CompletableFuture.failedFuture(e);
            }
            run.whenComplete((result, error) -> {
                inFlight.remove(task.id());
                MdcContext.setTask(task.id(), task.ownerNamespace());
                try {
                    complete(task, startedAt, result, failureOf(result, error));
                } finally {
                    MdcContext.clear();
                }
            });
        } finally {
            MdcContext.clear();
        }
    }

    private void complete(ScheduledTask task, Instant startedAt, WorkerResult result, String error) {
        Instant finishedAt = clock.instant();
        long durationMs = Duration.between(startedAt, finishedAt).toMillis();
        tasks.logRun(error == null
                ? TaskRunLog.success(task.id(), startedAt, durationMs, result.result())
                : TaskRunLog.failure(task.id(), startedAt, durationMs, error));
        metrics.recordScheduledRun(error == null ? "success" : "error", durationMs);
        if (error == null) {
            log.info("Task {} completed in {}ms", task.id(), durationMs);
        } else {
            log.error("Task {} failed after {}ms: {}", task.id(), durationMs, error);
        }

        Instant nextRun;
        try {
            nextRun = calculator.nextRun(task.scheduleType(), task.scheduleValue(), finishedAt);
        } catch (SchedulingSpecException e) {
            log.error("Task {} has an unusable schedule, completing it: {}", task.id(), e.getMessage());
            nextRun = null;
        }
        String summary = error != null ? "Error: " + error
                : result.hasResult() ? abbreviate(result.result()) : "Completed";

        var current = tasks.get(task.id()).orElse(null);
        if (current == null) {
            log.info("Task {} was cancelled while running", task.id());
            return;
        }
        tasks.update(current.afterRun(nextRun, startedAt, summary));
    }

    private static String failureOf(WorkerResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        }
        if (!result.isSuccess()) {
            return result.error() != null ? result.error() : "Unknown error";
        }
        return null;
    }

    private static String abbreviate(String s) {
        return s.length() <= SUMMARY_LENGTH ? s : s.substring(0, SUMMARY_LENGTH);
    }
}
