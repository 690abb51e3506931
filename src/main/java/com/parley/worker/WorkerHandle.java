package com.parley.worker;

import java.io.IOException;

/**
 * A running worker process.
 */
public interface WorkerHandle {

    String id();

    String name();

    /** Writes {@code line} plus a newline to the worker's standard input. */
    void sendLine(String line) throws IOException;

    /** Signals end of input. */
    void closeInput();

    /**
     * Requests forcible termination. Best effort: a worker that is already gone is not an error.
     */
    void terminate();

    boolean isAlive();
}
