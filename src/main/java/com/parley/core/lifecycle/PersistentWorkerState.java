package com.parley.core.lifecycle;

public enum PersistentWorkerState {
    STOPPED,
    STARTING,
    RUNNING,
    RESTARTING,
    /** Restart budget exhausted; the privileged namespace is served by one-shot workers only. */
    FATAL,
    SHUTTING_DOWN
}
