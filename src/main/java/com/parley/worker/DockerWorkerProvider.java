package com.parley.worker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Docker-based WorkerProvider. Each worker is one container with its standard streams attached.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>Bind mounts from the namespace mount contract</li>
 *   <li>Stdin kept open and attached; one-shot workers get stdin-once so closing input ends it</li>
 *   <li>Memory and CPU limits from the WorkerSpec</li>
 *   <li>Auto-remove, so an exited or killed worker leaves nothing behind</li>
 * </ul>
 */
public class DockerWorkerProvider implements WorkerProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerWorkerProvider.class);

    static final String CONTAINER_PREFIX = "parley-";
    private static final int ATTACH_TIMEOUT_SECONDS = 10;
    private static final int OUTPUT_DRAIN_SECONDS = 5;

    private final DockerClient dockerClient;

    public DockerWorkerProvider(DockerClient dockerClient) {
        this.dockerClient = dockerClient;
    }

    @Override
    public WorkerHandle spawn(WorkerSpec spec, WorkerListener listener) {
        String containerName = CONTAINER_PREFIX + spec.name();
        removeStale(containerName);

        var binds = new ArrayList<Bind>();
        for (VolumeMount mount : spec.mounts()) {
            binds.add(new Bind(mount.hostPath(), new Volume(mount.containerPath()),
                    mount.readOnly() ? AccessMode.ro : AccessMode.rw));
        }
        var hostConfig = HostConfig.newHostConfig()
                .withBinds(binds.toArray(new Bind[0]))
                .withAutoRemove(true)
                .withMemory((long) spec.memoryLimitMb() * 1024 * 1024)
                .withCpuCount((long) spec.cpuCount());

        var envList = new ArrayList<String>();
        spec.env().forEach((k, v) -> envList.add(k + "=" + v));

        var create = dockerClient.createContainerCmd(spec.image())
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withEnv(envList)
                .withLabels(Map.of("parley.worker", spec.name(),
                        "parley.persistent", String.valueOf(spec.persistent())))
                .withStdinOpen(true)
                .withStdInOnce(!spec.persistent())
                .withAttachStdin(true)
                .withAttachStdout(true)
                .withAttachStderr(true)
                .withTty(false);
        if (spec.user() != null && !spec.user().isBlank()) {
            create = create.withUser(spec.user());
        }

        String containerId;
        try {
            containerId = create.exec().getId();
        } catch (RuntimeException e) {
            throw new WorkerUnavailableException("Failed to create worker container " + containerName, e);
        }

        var handle = new DockerWorkerHandle(containerId, containerName, listener);
        try {
            var output = dockerClient.attachContainerCmd(containerId)
                    .withStdIn(handle.stdin)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(true)
                    .withLogs(false)
                    .exec(handle.outputCallback);
            if (!output.awaitStarted(ATTACH_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Attach to worker {} did not confirm within {}s", containerName, ATTACH_TIMEOUT_SECONDS);
            }
            dockerClient.startContainerCmd(containerId).exec();
            dockerClient.waitContainerCmd(containerId).exec(handle.exitCallback);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.terminate();
            throw new WorkerUnavailableException("Interrupted while starting worker " + containerName, e);
        } catch (RuntimeException e) {
            handle.terminate();
            throw new WorkerUnavailableException("Failed to start worker container " + containerName, e);
        }

        log.info("Worker {} started (container {}, persistent={})", containerName, containerId, spec.persistent());
        return handle;
    }

    private void removeStale(String containerName) {
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException e) {
            log.trace("No stale container named {}", containerName);
        } catch (RuntimeException e) {
            log.debug("Could not remove stale container {}: {}", containerName, e.getMessage());
        }
    }

    private final class DockerWorkerHandle implements WorkerHandle {

        private final String containerId;
        private final String containerName;
        private final WorkerListener listener;
        private final StdinPipe stdin = new StdinPipe();
        private final LineSplitter stdout;
        private final LineSplitter stderr;
        private final AtomicBoolean exited = new AtomicBoolean();

        private final ResultCallback.Adapter<Frame> outputCallback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                if (frame.getStreamType() == StreamType.STDERR) {
                    stderr.accept(frame.getPayload());
                } else {
                    stdout.accept(frame.getPayload());
                }
            }
        };

        private final ResultCallback.Adapter<WaitResponse> exitCallback = new ResultCallback.Adapter<>() {
            private volatile int statusCode = -1;

            @Override
            public void onNext(WaitResponse response) {
                if (response.getStatusCode() != null) {
                    statusCode = response.getStatusCode();
                }
            }

            @Override
            public void onComplete() {
                super.onComplete();
                fireExit(statusCode);
            }

            @Override
            public void onError(Throwable throwable) {
                log.warn("Wait on worker {} failed: {}", containerName, throwable.getMessage());
                super.onError(throwable);
                fireExit(statusCode);
            }
        };

        DockerWorkerHandle(String containerId, String containerName, WorkerListener listener) {
            this.containerId = containerId;
            this.containerName = containerName;
            this.listener = listener;
            this.stdout = new LineSplitter(listener::onStdout);
            this.stderr = new LineSplitter(listener::onStderr);
        }

        @Override
        public String id() {
            return containerId;
        }

        @Override
        public String name() {
            return containerName;
        }

        @Override
        public void sendLine(String line) throws IOException {
            if (exited.get()) {
                throw new IOException("Worker " + containerName + " has exited");
            }
            stdin.write((line + "\n").getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public void closeInput() {
            stdin.close();
        }

        @Override
        public void terminate() {
            stdin.close();
            try {
                dockerClient.killContainerCmd(containerId).exec();
                log.info("Worker {} terminated", containerName);
            } catch (NotFoundException | ConflictException e) {
                log.debug("Worker {} already stopped: {}", containerName, e.getMessage());
            } catch (RuntimeException e) {
                log.warn("Failed to kill worker {}", containerName, e);
            }
        }

        @Override
        public boolean isAlive() {
            return !exited.get();
        }

        private void fireExit(int exitCode) {
            if (!exited.compareAndSet(false, true)) return;
            try {
                outputCallback.awaitCompletion(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            stdout.flush();
            stderr.flush();
            stdin.close();
            log.info("Worker {} exited with code {}", containerName, exitCode);
            listener.onExit(exitCode);
        }
    }
}
