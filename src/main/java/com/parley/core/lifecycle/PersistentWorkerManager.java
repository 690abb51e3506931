package com.parley.core.lifecycle;

import com.parley.core.concurrent.LoopTask;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.config.ParleyProperties;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.protocol.ProtocolParseException;
import com.parley.core.protocol.RequestIds;
import com.parley.core.protocol.WireCodec;
import com.parley.core.protocol.WireRequest;
import com.parley.core.protocol.WireResponse;
import com.parley.worker.MountPlanner;
import com.parley.worker.RequestTimeoutException;
import com.parley.worker.WorkerCrashedException;
import com.parley.worker.WorkerHandle;
import com.parley.worker.WorkerListener;
import com.parley.worker.WorkerProvider;
import com.parley.worker.WorkerResult;
import com.parley.worker.WorkerSpec;
import com.parley.worker.WorkerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Supervises the single long-lived worker of the privileged namespace.
 *
 * <p>Many queries are multiplexed over the worker's stdin/stdout, matched up by request id
 * through the pending-correlation table. A crash rejects everything pending and triggers a
 * restart after {@code restartBaseDelay * 2^attempts}; once the restart budget is spent the
 * manager goes {@link PersistentWorkerState#FATAL} and stays there until {@link #start} is
 * called again from outside.
 *
 * <p>All methods must be called on the orchestrator loop. Worker output arrives on I/O threads
 * and is handed to the loop before touching any state.
 */
public class PersistentWorkerManager {

    private static final Logger log = LoggerFactory.getLogger(PersistentWorkerManager.class);

    static final String WORKER_NAME_PREFIX = "persistent-";

    private final WorkerProvider provider;
    private final MountPlanner mountPlanner;
    private final WireCodec codec;
    private final ParleyProperties.Persistent config;
    private final OrchestratorLoop loop;
    private final Executor ioExecutor;
    private final Clock clock;
    private final ParleyMetrics metrics;

    private final Map<String, PendingCorrelation> pending = new LinkedHashMap<>();

    private volatile PersistentWorkerState state = PersistentWorkerState.STOPPED;
    private RegisteredNamespace namespace;
    private WorkerHandle handle;
    private int generation;
    private volatile int restartAttempts;
    private LoopTask healthTask;
    private LoopTask restartTask;

    private record PendingCorrelation(String requestId, CompletableFuture<WorkerResult> future, LoopTask deadline) {}

    public PersistentWorkerManager(WorkerProvider provider, MountPlanner mountPlanner, WireCodec codec,
                                   ParleyProperties.Persistent config, OrchestratorLoop loop,
                                   Executor ioExecutor, Clock clock, ParleyMetrics metrics) {
        this.provider = provider;
        this.mountPlanner = mountPlanner;
        this.codec = codec;
        this.config = config;
        this.loop = loop;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Starts the worker for {@code privilegedNamespace}. No-op while starting or running.
     * An external start resets the restart budget, including after {@link PersistentWorkerState#FATAL}.
     */
    public void start(RegisteredNamespace privilegedNamespace) {
        if (state == PersistentWorkerState.RUNNING || state == PersistentWorkerState.STARTING) {
            log.debug("Persistent worker already {}", state);
            return;
        }
        if (restartTask != null) {
            restartTask.cancel();
            restartTask = null;
        }
        this.namespace = privilegedNamespace;
        this.restartAttempts = 0;
        spawn();
    }

    /**
     * Sends one query to the worker. Fails immediately with {@link WorkerUnavailableException}
     * when no worker is running. A timeout rejects only this query; the worker keeps running.
     */
    public CompletableFuture<WorkerResult> query(String prompt, String sessionId, String conversationKey) {
        if (state != PersistentWorkerState.RUNNING || handle == null) {
            return CompletableFuture.failedFuture(
                    new WorkerUnavailableException("Persistent worker is " + state.name().toLowerCase()));
        }
        String requestId = RequestIds.next("req", clock);
        var future = new CompletableFuture<WorkerResult>();
        Duration timeout = config.getRequestTimeout();
        LoopTask deadline = loop.schedule(timeout, () -> {
            if (pending.remove(requestId) != null) {
                log.warn("Persistent request {} timed out after {}ms, worker left running",
                        requestId, timeout.toMillis());
                metrics.recordRequestTimeout("persistent");
                future.completeExceptionally(new RequestTimeoutException(requestId, timeout));
            }
        });
        pending.put(requestId, new PendingCorrelation(requestId, future, deadline));

        var request = WireRequest.query(requestId, prompt, sessionId, namespace.folder(), conversationKey, true);
        try {
            handle.sendLine(codec.encode(request));
        } catch (IOException e) {
            pending.remove(requestId);
            deadline.cancel();
            future.completeExceptionally(new WorkerUnavailableException("Could not write to persistent worker", e));
            return future;
        }
        log.info("Sent {} to persistent worker ({} pending)", requestId, pending.size());
        return future;
    }

    /**
     * Stops the worker. Idempotent. Pending queries are rejected, a {@code shutdown} line is sent,
     * and after the grace period the container is killed. The returned future completes once the
     * kill has been requested.
     */
    public CompletableFuture<Void> shutdown() {
        if (state == PersistentWorkerState.SHUTTING_DOWN || state == PersistentWorkerState.STOPPED) {
            return CompletableFuture.completedFuture(null);
        }
        log.info("Shutting down persistent worker");
        setState(PersistentWorkerState.SHUTTING_DOWN);
        cancelHealthChecks();
        if (restartTask != null) {
            restartTask.cancel();
            restartTask = null;
        }
        rejectAllPending(new WorkerUnavailableException("Persistent worker is shutting down"));

        WorkerHandle current = handle;
        if (current == null) {
            setState(PersistentWorkerState.STOPPED);
            return CompletableFuture.completedFuture(null);
        }
        try {
            current.sendLine(codec.encode(WireRequest.shutdown()));
        } catch (IOException e) {
            log.debug("Could not send shutdown line: {}", e.getMessage());
        }
        var done = new CompletableFuture<Void>();
        loop.schedule(config.getShutdownGrace(), () -> {
            ioExecutor.execute(current::terminate);
            handle = null;
            setState(PersistentWorkerState.STOPPED);
            done.complete(null);
        });
        return done;
    }

    public boolean isAvailable() {
        return state == PersistentWorkerState.RUNNING;
    }

    /** True once the restart budget is exhausted. */
    public boolean isFallbackOnly() {
        return state == PersistentWorkerState.FATAL;
    }

    public PersistentWorkerState state() {
        return state;
    }

    public int restartAttempts() {
        return restartAttempts;
    }

    public int pendingCount() {
        return pending.size();
    }

    private void spawn() {
        setState(restartAttempts == 0 ? PersistentWorkerState.STARTING : PersistentWorkerState.RESTARTING);
        int gen = ++generation;
        WorkerSpec spec = mountPlanner.specFor(namespace, true, WORKER_NAME_PREFIX + namespace.folder(), true);
        ioExecutor.execute(() -> {
            try {
                WorkerHandle spawned = provider.spawn(spec, listenerFor(gen));
                loop.execute(() -> onSpawned(gen, spawned));
            } catch (RuntimeException e) {
                log.error("Failed to start persistent worker: {}", e.getMessage(), e);
                loop.execute(() -> onWorkerLost(gen, "spawn failed"));
            }
        });
    }

    private WorkerListener listenerFor(int gen) {
        return new WorkerListener() {
            @Override
            public void onStdout(String line) {
                loop.execute(() -> onLine(gen, line));
            }

            @Override
            public void onStderr(String line) {
                log.debug("[persistent] {}", line);
            }

            @Override
            public void onExit(int exitCode) {
                loop.execute(() -> onWorkerLost(gen, "exit code " + exitCode));
            }
        };
    }

    private void onSpawned(int gen, WorkerHandle spawned) {
        if (gen != generation || state == PersistentWorkerState.SHUTTING_DOWN
                || state == PersistentWorkerState.STOPPED) {
            log.info("Discarding worker {} started for a superseded generation", spawned.name());
            ioExecutor.execute(spawned::terminate);
            return;
        }
        if (!spawned.isAlive()) {
            // exit was already queued behind this turn
            handle = spawned;
            return;
        }
        handle = spawned;
        setState(PersistentWorkerState.RUNNING);
        startHealthChecks();
        log.info("Persistent worker {} running (restart attempts so far: {})", spawned.name(), restartAttempts);
    }

    private void onLine(int gen, String line) {
        if (gen != generation) {
            return;
        }
        WireResponse response;
        try {
            response = codec.decodeLine(line);
        } catch (ProtocolParseException e) {
            log.debug("Ignoring non-protocol worker output: {}", e.getMessage());
            return;
        }
        String requestId = response.requestId();
        if (requestId.startsWith("health-")) {
            log.debug("Health pong {}", requestId);
            return;
        }
        PendingCorrelation correlation = pending.remove(requestId);
        if (correlation == null) {
            log.warn("Dropping response for unknown request id {}", requestId);
            return;
        }
        correlation.deadline().cancel();
        correlation.future().complete(WorkerResult.from(response));
    }

    private void onWorkerLost(int gen, String reason) {
        if (gen != generation) {
            log.debug("Ignoring exit of superseded persistent worker ({})", reason);
            return;
        }
        cancelHealthChecks();
        handle = null;
        rejectAllPending(new WorkerCrashedException("Persistent worker crashed (" + reason + ")"));

        if (state == PersistentWorkerState.SHUTTING_DOWN || state == PersistentWorkerState.STOPPED) {
            setState(PersistentWorkerState.STOPPED);
            return;
        }
        log.warn("Persistent worker lost: {} (restart attempts: {})", reason, restartAttempts);

        int max = config.getMaxRestartAttempts();
        if (restartAttempts < max) {
            Duration delay = config.getRestartBaseDelay().multipliedBy(1L << restartAttempts);
            restartAttempts++;
            metrics.recordWorkerRestart(restartAttempts);
            setState(PersistentWorkerState.RESTARTING);
            log.warn("Restarting persistent worker in {}ms (attempt {}/{})", delay.toMillis(), restartAttempts, max);
            restartTask = loop.schedule(delay, () -> {
                restartTask = null;
                if (state == PersistentWorkerState.RESTARTING) {
                    spawn();
                }
            });
        } else {
            log.error("Persistent worker exceeded {} restart attempts; routing privileged namespace to one-shot workers",
                    max);
            metrics.recordPersistentFallback();
            setState(PersistentWorkerState.FATAL);
        }
    }

    private void startHealthChecks() {
        cancelHealthChecks();
        Duration interval = config.getHealthCheckInterval();
        healthTask = loop.scheduleAtFixedRate(interval, interval, () -> {
            if (handle == null) return;
            try {
                handle.sendLine(codec.encode(WireRequest.health(RequestIds.next("health", clock))));
            } catch (IOException e) {
                log.debug("Health ping not sent: {}", e.getMessage());
            }
        });
    }

    private void cancelHealthChecks() {
        if (healthTask != null) {
            healthTask.cancel();
            healthTask = null;
        }
    }

    private void rejectAllPending(RuntimeException cause) {
        if (pending.isEmpty()) return;
        log.warn("Rejecting {} pending persistent request(s): {}", pending.size(), cause.getMessage());
        var snapshot = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingCorrelation correlation : snapshot) {
            correlation.deadline().cancel();
            correlation.future().completeExceptionally(cause);
        }
    }

    private void setState(PersistentWorkerState next) {
        if (state == next) return;
        log.info("Persistent worker state {} -> {}", state, next);
        state = next;
    }
}
