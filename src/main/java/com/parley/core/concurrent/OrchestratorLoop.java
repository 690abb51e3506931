package com.parley.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single-threaded event loop that owns all orchestrator state.
 *
 * <p>The correlation table, active conversation requests, subagent set and namespace
 * registry are only mutated from tasks running on this loop, so each task is one atomic
 * turn and no further locking is needed. Worker I/O threads hand their results back via
 * {@link #execute(Runnable)}.
 *
 * <p>A failing task is logged and the loop carries on with the next one.
 */
public class OrchestratorLoop implements Executor {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public OrchestratorLoop() {
        this("parley-loop");
    }

    public OrchestratorLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, threadName);
            t.setDaemon(true);
            loopThread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Loop is shut down, dropping task");
        }
    }

    /**
     * Runs {@code work} on the loop and exposes its outcome as a future.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        var future = new CompletableFuture<T>();
        execute(() -> {
            try {
                future.complete(work.get());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    public LoopTask schedule(Duration delay, Runnable task) {
        try {
            return wrap(executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("Loop is shut down, not scheduling task");
            return CANCELLED;
        }
    }

    public LoopTask scheduleAtFixedRate(Duration initialDelay, Duration period, Runnable task) {
        try {
            return wrap(executor.scheduleAtFixedRate(guarded(task),
                    initialDelay.toMillis(), period.toMillis(), TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("Loop is shut down, not scheduling periodic task");
            return CANCELLED;
        }
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public void shutdown(Duration await) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Orchestrator loop stopped");
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Unhandled error in orchestrator loop turn: {}", e.getMessage(), e);
            }
        };
    }

    private static LoopTask wrap(ScheduledFuture<?> future) {
        return new LoopTask() {
            @Override
            public void cancel() {
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return future.isCancelled();
            }
        };
    }

    private static final LoopTask CANCELLED = new LoopTask() {
        @Override
        public void cancel() {
        }

        @Override
        public boolean isCancelled() {
            return true;
        }
    };
}
