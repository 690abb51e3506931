package com.parley.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.core.concurrent.CancellationToken;
import com.parley.core.model.ContainerOptions;
import com.parley.core.model.RegisteredNamespace;
import com.parley.core.protocol.WireCodec;
import com.parley.core.protocol.WireResponse;
import com.parley.testsupport.FakeWorkerProvider;
import com.parley.testsupport.ManualLoop;
import com.parley.testsupport.MutableClock;
import com.parley.testsupport.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static com.parley.testsupport.TestFixtures.failureOf;
import static org.junit.jupiter.api.Assertions.*;

class EphemeralWorkerPoolTest {

    @TempDir
    Path tmp;

    private ManualLoop loop;
    private FakeWorkerProvider provider;
    private WorkerProperties workerProperties;
    private EphemeralWorkerPool pool;

    @BeforeEach
    void setUp() {
        var clock = new MutableClock(TestFixtures.T0);
        loop = new ManualLoop(clock);
        provider = new FakeWorkerProvider();
        workerProperties = new WorkerProperties();
        var planner = new MountPlanner(TestFixtures.properties(tmp), workerProperties, tmp.resolve("project"));
        pool = new EphemeralWorkerPool(provider, planner, new WireCodec(new ObjectMapper()), workerProperties,
                loop, Runnable::run, clock, TestFixtures.metrics());
    }

    private static WorkerInvocation invocation(RegisteredNamespace namespace) {
        return new WorkerInvocation(namespace, "chat-family", "<messages/>", "sess-1", false, false, "chat");
    }

    @Test
    @DisplayName("writes one request, closes stdin and resolves with the framed response")
    void framedResponse() {
        var future = pool.run(invocation(TestFixtures.namespace("family")), new CancellationToken());
        var worker = provider.last();

        assertTrue(worker.isInputClosed());
        assertEquals(1, worker.requests().size());
        var request = worker.requests().get(0);
        assertTrue(request.requestId().startsWith("chat-"));
        assertEquals("family", request.namespace());
        assertEquals("sess-1", request.sessionId());
        assertFalse(worker.spec().persistent());
        assertTrue(worker.spec().name().startsWith("family-chat-"));
        assertEquals(1, pool.activeCount());

        worker.respondFramed(new WireResponse(null, WireResponse.SUCCESS, "hello", "sess-2", null));

        var result = future.join();
        assertEquals("hello", result.result());
        assertEquals("sess-2", result.newSessionId());
        assertEquals(0, pool.activeCount());
    }

    @Test
    @DisplayName("exit without a framed response is a worker error")
    void exitWithoutResponse() {
        var future = pool.run(invocation(TestFixtures.namespace("family")), new CancellationToken());

        provider.last().emit("Segmentation fault");
        provider.last().exit(139);

        var failure = failureOf(future);
        assertInstanceOf(WorkerErrorException.class, failure);
        assertTrue(failure.getMessage().contains("139"));
    }

    @Test
    @DisplayName("cancellation terminates the worker and discards its later output")
    void cancellationTerminates() {
        var token = new CancellationToken();
        var future = pool.run(invocation(TestFixtures.namespace("family")), token);
        var worker = provider.last();

        token.cancel();

        assertTrue(worker.isTerminated());
        assertInstanceOf(CancellationException.class, failureOf(future));

        worker.respondFramed(new WireResponse(null, WireResponse.SUCCESS, "too late", null, null));
        assertInstanceOf(CancellationException.class, failureOf(future));
        assertTrue(loop.failures().isEmpty());
    }

    @Test
    @DisplayName("an already cancelled token never spawns a worker")
    void cancelledBeforeStart() {
        var token = new CancellationToken();
        token.cancel();

        var future = pool.run(invocation(TestFixtures.namespace("family")), token);

        assertInstanceOf(CancellationException.class, failureOf(future));
        assertEquals(0, provider.spawnCount());
    }

    @Test
    @DisplayName("timeout terminates the worker, honouring the namespace override")
    void timeout() {
        var options = new ContainerOptions(30_000L, Map.of());
        var namespace = new RegisteredNamespace("Family", "family", "@Parley", TestFixtures.T0, options);
        var future = pool.run(invocation(namespace), new CancellationToken());

        loop.advance(Duration.ofSeconds(29));
        assertFalse(future.isDone());

        loop.advance(Duration.ofSeconds(1));

        assertInstanceOf(RequestTimeoutException.class, failureOf(future));
        assertTrue(provider.last().isTerminated());
    }

    @Test
    @DisplayName("spawn failure fails the request")
    void spawnFailure() {
        provider.failNextSpawns(1);

        var future = pool.run(invocation(TestFixtures.namespace("family")), new CancellationToken());

        assertInstanceOf(WorkerUnavailableException.class, failureOf(future));
        assertEquals(0, pool.activeCount());
    }

    @Test
    @DisplayName("oversized output keeps the tail so the framed response survives")
    void outputCapKeepsTail() {
        workerProperties.setMaxOutputBytes(256);
        var future = pool.run(invocation(TestFixtures.namespace("family")), new CancellationToken());
        var worker = provider.last();
        for (int i = 0; i < 50; i++) {
            worker.emit("progress line " + i);
        }

        worker.respondFramed(new WireResponse(null, WireResponse.SUCCESS, "ok", null, null));

        assertEquals("ok", future.join().result());
    }
}
