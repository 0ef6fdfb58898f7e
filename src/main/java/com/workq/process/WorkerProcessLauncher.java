package com.workq.process;

/**
 * Starts worker processes for the {@link WorkerSupervisor}.
 */
@FunctionalInterface
public interface WorkerProcessLauncher {

    /**
     * Starts the worker with the given ordinal. Returns as soon as the process exists; the handshake is
     * awaited by the supervisor.
     *
     * @throws WorkerStartupException if the process cannot be started
     */
    WorkerHandle launch(int ordinal);
}
