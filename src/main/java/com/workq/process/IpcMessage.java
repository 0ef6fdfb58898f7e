package com.workq.process;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A message a worker process sends to its supervisor.
 *
 * @param workerId ordinal of the worker within the pool
 * @param error    failure description, only set on {@link IpcMessageType#WORKER_ERROR}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IpcMessage(IpcMessageType type, long pid, Integer workerId, String error) {

    public IpcMessage {
        Objects.requireNonNull(type, "type");
    }

    public static IpcMessage started(long pid, int workerId) {
        return new IpcMessage(IpcMessageType.WORKER_STARTED, pid, workerId, null);
    }

    public static IpcMessage shutdown(long pid, int workerId) {
        return new IpcMessage(IpcMessageType.WORKER_SHUTDOWN, pid, workerId, null);
    }

    public static IpcMessage error(long pid, int workerId, String error) {
        return new IpcMessage(IpcMessageType.WORKER_ERROR, pid, workerId, error);
    }
}
