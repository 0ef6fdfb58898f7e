package com.workq.process;

import com.workq.internal.JobExecutionLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.io.PrintStream;
import java.time.Duration;
import java.util.function.IntConsumer;

/**
 * Runs inside a worker process. Starts the {@link JobExecutionLoop} on a dedicated thread, tells the
 * supervisor it is ready and exits when the supervisor process disappears.
 */
public class WorkerProcessAgent implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessAgent.class);

    private final JobExecutionLoop loop;
    private final int workerId;
    private final Duration stopTimeout;
    private final PrintStream ipcOut;
    private final IntConsumer exit;
    private final long pid = ProcessHandle.current().pid();

    private volatile Thread loopThread;
    private volatile boolean running = false;

    /**
     * @param ipcOut stream read by the supervisor, normally {@code System.out}
     * @param exit   terminates this process with the given status
     */
    public WorkerProcessAgent(JobExecutionLoop loop, int workerId, Duration stopTimeout, PrintStream ipcOut,
            IntConsumer exit) {
        this.loop = loop;
        this.workerId = workerId;
        this.stopTimeout = stopTimeout;
        this.ipcOut = ipcOut;
        this.exit = exit;
    }

    @Override
    public void start() {
        Thread thread = new Thread(loop, "workq-worker-" + workerId);
        thread.setUncaughtExceptionHandler((failedThread, error) -> {
            log.error("Job execution loop of worker {} died", workerId, error);
            send(IpcMessage.error(pid, workerId, String.valueOf(error)));
            exit.accept(1);
        });
        this.loopThread = thread;
        thread.start();
        running = true;

        send(IpcMessage.started(pid, workerId));
        log.info("Worker {} started with pid {}", workerId, pid);

        ProcessHandle.current().parent().ifPresent(parent -> parent.onExit().thenRun(() -> {
            if (running) {
                log.warn("Supervisor process {} is gone; worker {} exits", parent.pid(), workerId);
                exit.accept(0);
            }
        }));
    }

    /**
     * Lets the current job finish within the stop timeout, then interrupts the loop.
     */
    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        loop.stop();
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(stopTimeout.toMillis());
                if (thread.isAlive()) {
                    log.warn("Worker {} did not finish its current job within {}; interrupting", workerId, stopTimeout);
                    thread.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        send(IpcMessage.shutdown(pid, workerId));
        log.info("Worker {} shut down", workerId);
    }

    private void send(IpcMessage message) {
        String line = IpcMessageCodec.encode(message);
        synchronized (ipcOut) {
            ipcOut.println(line);
            ipcOut.flush();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    public long getPid() {
        return pid;
    }
}
