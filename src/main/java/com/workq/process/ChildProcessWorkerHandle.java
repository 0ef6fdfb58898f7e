package com.workq.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A worker running as a child process. A reader thread consumes the child's merged stdout/stderr:
 * IPC lines drive the handshake, everything else is relayed to the {@code com.workq.worker} logger.
 */
public class ChildProcessWorkerHandle implements WorkerHandle {

    private static final Logger log = LoggerFactory.getLogger(ChildProcessWorkerHandle.class);

    private final int ordinal;
    private final Process process;
    private final Logger outputLog;
    private final CompletableFuture<IpcMessage> handshake = new CompletableFuture<>();
    private final CompletableFuture<Integer> exit;

    public ChildProcessWorkerHandle(int ordinal, Process process) {
        this.ordinal = ordinal;
        this.process = process;
        this.outputLog = LoggerFactory.getLogger("com.workq.worker." + ordinal);
        this.exit = process.onExit().thenApply(Process::exitValue);
        this.exit.whenComplete((code, error) -> handshake.completeExceptionally(new WorkerStartupException(
                "Worker " + ordinal + " (pid " + process.pid() + ") exited with code " + code + " before handshake")));

        Thread reader = new Thread(this::readOutput, "workq-worker-" + ordinal + "-output");
        reader.setDaemon(true);
        reader.start();
    }

    private void readOutput() {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                handleLine(line);
            }
        } catch (IOException e) {
            if (process.isAlive()) {
                log.warn("Lost output stream of worker {} (pid {})", ordinal, process.pid(), e);
            }
        }
    }

    void handleLine(String line) {
        Optional<IpcMessage> message;
        try {
            message = IpcMessageCodec.decode(line);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed message from worker {} (pid {}): {}", ordinal, process.pid(), e.getMessage());
            return;
        }
        if (message.isEmpty()) {
            outputLog.info(line);
            return;
        }
        IpcMessage ipc = message.get();
        switch (ipc.type()) {
            case WORKER_STARTED -> handshake.complete(ipc);
            case WORKER_SHUTDOWN -> log.info("Worker {} (pid {}) reported shutdown", ordinal, ipc.pid());
            case WORKER_ERROR -> log.error("Worker {} (pid {}) reported an error: {}", ordinal, ipc.pid(), ipc.error());
        }
    }

    @Override
    public int ordinal() {
        return ordinal;
    }

    @Override
    public long pid() {
        return process.pid();
    }

    @Override
    public CompletableFuture<IpcMessage> handshake() {
        return handshake;
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return exit;
    }

    @Override
    public void terminate() {
        process.destroy();
    }

    @Override
    public void kill() {
        process.destroyForcibly();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public String toString() {
        return "Worker[" + ordinal + ", pid=" + process.pid() + "]";
    }
}
