package com.parley.worker;

/**
 * Abstraction for starting isolated worker processes.
 * Implementation: {@link DockerWorkerProvider}.
 */
public interface WorkerProvider {

    /**
     * Starts a worker and wires its output to {@code listener}.
     * Blocks while the process is being created; call from an I/O thread.
     *
     * @throws WorkerUnavailableException if the worker could not be started
     */
    WorkerHandle spawn(WorkerSpec spec, WorkerListener listener);
}
