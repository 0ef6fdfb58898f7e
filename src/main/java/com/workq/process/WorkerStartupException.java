package com.workq.process;

/**
 * A worker process could not be started or did not complete its handshake in time.
 */
public class WorkerStartupException extends RuntimeException {

    public WorkerStartupException(String message) {
        super(message);
    }

    public WorkerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
