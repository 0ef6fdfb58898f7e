package com.workq.process;

/**
 * Point-in-time counters of a {@link WorkerSupervisor}.
 *
 * @param configured      number of workers the pool should have
 * @param live            workers that completed their handshake and have not exited
 * @param startedTotal    processes launched since the supervisor started
 * @param restarts        restarts scheduled after an exit or a failed startup
 * @param startupFailures launches that failed or did not complete the handshake in time
 * @param unexpectedExits live workers that exited while the pool was running
 */
public record WorkerPoolHealth(
        int configured,
        int live,
        long startedTotal,
        long restarts,
        long startupFailures,
        long unexpectedExits) {

    public boolean isFullyStaffed() {
        return live >= configured;
    }
}
