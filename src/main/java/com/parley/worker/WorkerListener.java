package com.parley.worker;

/**
 * Receives a worker's output. Called from I/O threads, never from the orchestrator loop.
 */
public interface WorkerListener {

    /** One complete line of standard output, without the trailing newline. */
    void onStdout(String line);

    /** One complete line of standard error. */
    void onStderr(String line);

    /** The worker process has exited; called exactly once, after all output lines. */
    void onExit(int exitCode);
}
