package com.workq.process;

import java.util.concurrent.CompletableFuture;

/**
 * The supervisor's view of one worker process.
 */
public interface WorkerHandle {

    /**
     * Position of the worker in the pool, stable across restarts.
     */
    int ordinal();

    long pid();

    /**
     * Completes with the {@code worker-started} message, or exceptionally if the process exits first.
     */
    CompletableFuture<IpcMessage> handshake();

    /**
     * Completes with the exit code once the process has terminated.
     */
    CompletableFuture<Integer> onExit();

    /**
     * Requests a graceful stop (SIGTERM).
     */
    void terminate();

    /**
     * Forcibly kills the process (SIGKILL).
     */
    void kill();

    boolean isAlive();
}
