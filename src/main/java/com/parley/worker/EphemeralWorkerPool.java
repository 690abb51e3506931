package com.parley.worker;

import com.parley.core.concurrent.CancellationToken;
import com.parley.core.concurrent.LoopTask;
import com.parley.core.concurrent.OrchestratorLoop;
import com.parley.core.metrics.ParleyMetrics;
import com.parley.core.protocol.ProtocolParseException;
import com.parley.core.protocol.RequestIds;
import com.parley.core.protocol.WireCodec;
import com.parley.core.protocol.WireRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs one worker container per request.
 *
 * <p>{@link #run} must be called on the orchestrator loop. The returned future also completes
 * on the loop. Cancelling the token requests termination of the container and fails the
 * future with {@link CancellationException}; the worker's eventual output is discarded.
 */
public class EphemeralWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(EphemeralWorkerPool.class);

    private final WorkerProvider provider;
    private final MountPlanner mountPlanner;
    private final WireCodec codec;
    private final WorkerProperties properties;
    private final OrchestratorLoop loop;
    private final Executor ioExecutor;
    private final Clock clock;
    private final ParleyMetrics metrics;

    private int active;

    public EphemeralWorkerPool(WorkerProvider provider, MountPlanner mountPlanner, WireCodec codec,
                               WorkerProperties properties, OrchestratorLoop loop, Executor ioExecutor,
                               Clock clock, ParleyMetrics metrics) {
        this.provider = provider;
        this.mountPlanner = mountPlanner;
        this.codec = codec;
        this.properties = properties;
        this.loop = loop;
        this.ioExecutor = ioExecutor;
        this.clock = clock;
        this.metrics = metrics;
    }

    public CompletableFuture<WorkerResult> run(WorkerInvocation invocation, CancellationToken token) {
        if (token.isCancelled()) {
            return CompletableFuture.failedFuture(new CancellationException("Cancelled before start"));
        }
        String requestId = RequestIds.next(invocation.label(), clock);
        String folder = invocation.namespace().folder();
        WireRequest request = invocation.scheduled()
                ? WireRequest.scheduled(requestId, invocation.prompt(), invocation.sessionId(),
                        folder, invocation.conversationKey(), invocation.privileged())
                : WireRequest.query(requestId, invocation.prompt(), invocation.sessionId(),
                        folder, invocation.conversationKey(), invocation.privileged());
        WorkerSpec spec = mountPlanner.specFor(invocation.namespace(), invocation.privileged(),
                folder + "-" + requestId, false);

        var run = new Run(requestId, properties.getMaxOutputBytes());
        active++;
        metrics.workerStarted();
        run.future.whenComplete((r, e) -> {
            active--;
            metrics.workerFinished();
        });

        Duration timeout = timeoutFor(invocation);
        run.timeoutTask = loop.schedule(timeout, () -> {
            if (run.settle()) {
                log.warn("Worker {} timed out after {}ms, terminating", requestId, timeout.toMillis());
                metrics.recordRequestTimeout("ephemeral");
                terminate(run);
                run.future.completeExceptionally(new RequestTimeoutException(requestId, timeout));
            }
        });
        token.onCancel(() -> loop.execute(() -> {
            if (run.settle()) {
                log.info("Worker {} cancelled, terminating", requestId);
                run.timeoutTask.cancel();
                terminate(run);
                run.future.completeExceptionally(new CancellationException("Request " + requestId + " cancelled"));
            }
        }));

        String line = codec.encode(request);
        ioExecutor.execute(() -> start(run, spec, line));
        log.info("Dispatched {} to one-shot worker for {}", requestId, folder);
        return run.future;
    }

    /** Workers started by this pool and not yet finished. Loop thread only. */
    public int activeCount() {
        return active;
    }

    private void start(Run run, WorkerSpec spec, String line) {
        WorkerHandle handle;
        try {
            handle = provider.spawn(spec, new WorkerListener() {
                @Override
                public void onStdout(String out) {
                    run.append(out);
                }

                @Override
                public void onStderr(String err) {
                    log.debug("[{}] {}", run.requestId, err);
                }

                @Override
                public void onExit(int exitCode) {
                    loop.execute(() -> finish(run, exitCode));
                }
            });
        } catch (RuntimeException e) {
            loop.execute(() -> {
                if (run.settle()) {
                    run.timeoutTask.cancel();
                    run.future.completeExceptionally(e instanceof WorkerUnavailableException
                            ? e : new WorkerUnavailableException("Failed to spawn worker", e));
                }
            });
            return;
        }
        run.handle = handle;
        if (run.terminated) {
            handle.terminate();
            return;
        }
        try {
            handle.sendLine(line);
            handle.closeInput();
        } catch (IOException e) {
            log.warn("Could not write request {} to worker: {}", run.requestId, e.getMessage());
            handle.terminate();
        }
    }

    private void finish(Run run, int exitCode) {
        if (!run.settle()) {
            log.debug("Worker {} exited with {} after its request was settled", run.requestId, exitCode);
            return;
        }
        run.timeoutTask.cancel();
        try {
            var response = codec.decodeFramed(run.output());
            log.info("Worker {} finished with status {} (exit {})", run.requestId, response.status(), exitCode);
            run.future.complete(WorkerResult.from(response));
        } catch (ProtocolParseException e) {
            log.error("Worker {} exited with code {} without a readable response: {}",
                    run.requestId, exitCode, e.getMessage());
            run.future.completeExceptionally(new WorkerErrorException(
                    "Worker exited with code " + exitCode + " without a response"));
        }
    }

    private void terminate(Run run) {
        run.terminated = true;
        WorkerHandle handle = run.handle;
        if (handle != null) {
            ioExecutor.execute(handle::terminate);
        }
    }

    private Duration timeoutFor(WorkerInvocation invocation) {
        var options = invocation.namespace().containerOptions();
        if (options != null && options.timeoutMs() != null && options.timeoutMs() > 0) {
            return Duration.ofMillis(options.timeoutMs());
        }
        return properties.getTimeout();
    }

    private static final class Run {
        final String requestId;
        final int maxOutput;
        final CompletableFuture<WorkerResult> future = new CompletableFuture<>();
        final StringBuilder stdout = new StringBuilder();
        volatile WorkerHandle handle;
        volatile boolean terminated;
        LoopTask timeoutTask;
        boolean settled;
        boolean truncated;

        Run(String requestId, int maxOutput) {
            this.requestId = requestId;
            this.maxOutput = maxOutput;
        }

        /** Marks the run settled; false if it already was. Loop thread only. */
        boolean settle() {
            if (settled) return false;
            settled = true;
            return true;
        }

        synchronized void append(String line) {
            stdout.append(line).append('\n');
            if (stdout.length() > maxOutput) {
                // keep the tail, the framed response comes last
                stdout.delete(0, stdout.length() - maxOutput);
                if (!truncated) {
                    truncated = true;
                    log.warn("Worker {} output exceeded {} chars, keeping the tail", requestId, maxOutput);
                }
            }
        }

        synchronized String output() {
            return stdout.toString();
        }
    }
}
