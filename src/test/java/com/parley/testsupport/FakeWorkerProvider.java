package com.parley.testsupport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.core.protocol.WireCodec;
import com.parley.core.protocol.WireRequest;
import com.parley.core.protocol.WireResponse;
import com.parley.worker.WorkerHandle;
import com.parley.worker.WorkerListener;
import com.parley.worker.WorkerProvider;
import com.parley.worker.WorkerSpec;
import com.parley.worker.WorkerUnavailableException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory {@link WorkerProvider}. Every spawn produces a {@link FakeWorker} the test can
 * drive: read what was written to its stdin, emit output lines, make it exit.
 */
public class FakeWorkerProvider implements WorkerProvider {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<FakeWorker> workers = new CopyOnWriteArrayList<>();
    private int failuresRemaining;

    @Override
    public WorkerHandle spawn(WorkerSpec spec, WorkerListener listener) {
        if (failuresRemaining > 0) {
            failuresRemaining--;
            throw new WorkerUnavailableException("Simulated spawn failure for " + spec.name());
        }
        var worker = new FakeWorker(spec, listener, "fake-" + (workers.size() + 1));
        workers.add(worker);
        return worker;
    }

    /** The next {@code count} spawns throw {@link WorkerUnavailableException}. */
    public void failNextSpawns(int count) {
        this.failuresRemaining = count;
    }

    public List<FakeWorker> workers() {
        return workers;
    }

    public int spawnCount() {
        return workers.size();
    }

    public FakeWorker last() {
        if (workers.isEmpty()) {
            throw new IllegalStateException("No worker has been spawned");
        }
        return workers.get(workers.size() - 1);
    }

    public static final class FakeWorker implements WorkerHandle {

        private final WorkerSpec spec;
        private final WorkerListener listener;
        private final String id;
        private final List<String> stdin = new CopyOnWriteArrayList<>();
        private volatile boolean inputClosed;
        private volatile boolean terminated;
        private volatile boolean exited;

        FakeWorker(WorkerSpec spec, WorkerListener listener, String id) {
            this.spec = spec;
            this.listener = listener;
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public String name() {
            return spec.name();
        }

        @Override
        public void sendLine(String line) throws IOException {
            if (inputClosed || terminated || exited) {
                throw new IOException("stdin closed");
            }
            stdin.add(line);
        }

        @Override
        public void closeInput() {
            inputClosed = true;
        }

        @Override
        public void terminate() {
            terminated = true;
        }

        @Override
        public boolean isAlive() {
            return !terminated && !exited;
        }

        public WorkerSpec spec() {
            return spec;
        }

        public boolean isTerminated() {
            return terminated;
        }

        public boolean isInputClosed() {
            return inputClosed;
        }

        public List<String> stdinLines() {
            return List.copyOf(stdin);
        }

        /** Requests written to stdin, decoded. */
        public List<WireRequest> requests() {
            var requests = new ArrayList<WireRequest>();
            for (String line : stdin) {
                try {
                    requests.add(MAPPER.readValue(line, WireRequest.class));
                } catch (JsonProcessingException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return requests;
        }

        /** Requests with the {@code query} command, in the order they were written. */
        public List<WireRequest> queries() {
            return requests().stream().filter(r -> WireRequest.QUERY.equals(r.command())).toList();
        }

        public void emit(String line) {
            listener.onStdout(line);
        }

        public void emitStderr(String line) {
            listener.onStderr(line);
        }

        /** Writes one NDJSON response line, as the persistent worker does. */
        public void respond(WireResponse response) {
            emit(json(response));
        }

        /** Prints a framed response and exits 0, as a one-shot worker does. */
        public void respondFramed(WireResponse response) {
            emit("agent log noise");
            emit(WireCodec.OUTPUT_START_MARKER);
            emit(json(response));
            emit(WireCodec.OUTPUT_END_MARKER);
            exit(0);
        }

        public void exit(int code) {
            exited = true;
            listener.onExit(code);
        }

        private static String json(WireResponse response) {
            try {
                return MAPPER.writeValueAsString(response);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
