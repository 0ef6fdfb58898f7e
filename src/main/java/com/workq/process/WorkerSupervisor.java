package com.workq.process;

import com.workq.config.WorkQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Keeps a pool of worker processes alive.
 * <p>
 * Each worker must send its {@code worker-started} handshake within {@code workq.workers.startup-timeout}
 * or it is killed. Workers that fail to start or exit unexpectedly are relaunched under the same ordinal
 * after an exponential backoff that resets once a handshake succeeds. On shutdown every worker is asked to
 * terminate and killed if it is still alive after {@code workq.workers.shutdown-timeout}.
 */
public class WorkerSupervisor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(WorkerSupervisor.class);

    private final WorkerProcessLauncher launcher;
    private final WorkerRegistry registry;
    private final WorkQProperties.Workers settings;
    private volatile ScheduledExecutorService restartScheduler;

    private final Map<Integer, WorkerHandle> starting = new ConcurrentHashMap<>();
    private final Map<Integer, Duration> nextBackoff = new ConcurrentHashMap<>();
    private final AtomicLong startedTotal = new AtomicLong();
    private final AtomicLong restarts = new AtomicLong();
    private final AtomicLong startupFailures = new AtomicLong();
    private final AtomicLong unexpectedExits = new AtomicLong();

    private volatile int configuredCount = 0;
    private volatile boolean running = false;
    private volatile boolean stopping = false;

    public WorkerSupervisor(WorkerProcessLauncher launcher, WorkerRegistry registry, WorkQProperties.Workers settings) {
        this.launcher = launcher;
        this.registry = registry;
        this.settings = settings;
    }

    /**
     * Launches the configured number of workers and waits until each of them either completed its
     * handshake or failed to start. Failed workers are retried in the background.
     */
    @Override
    public void start() {
        if (running) {
            return;
        }
        stopping = false;
        nextBackoff.clear();
        restartScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "workq-supervisor");
            thread.setDaemon(true);
            return thread;
        });
        configuredCount = settings.resolveCount();
        running = true;
        if (configuredCount == 0) {
            log.info("Worker pool configured with 0 workers; no worker process will be started");
            return;
        }

        log.info("Starting worker pool with {} worker(s)", configuredCount);
        List<CompletableFuture<Void>> settled = new ArrayList<>(configuredCount);
        for (int ordinal = 0; ordinal < configuredCount; ordinal++) {
            settled.add(spawn(ordinal));
        }
        CompletableFuture.allOf(settled.toArray(CompletableFuture[]::new)).join();
        log.info("Worker pool started: {} of {} worker(s) live, pids {}", registry.size(), configuredCount,
                registry.pids());
    }

    private CompletableFuture<Void> spawn(int ordinal) {
        if (stopping) {
            return CompletableFuture.completedFuture(null);
        }
        WorkerHandle handle;
        try {
            handle = launcher.launch(ordinal);
        } catch (WorkerStartupException e) {
            startupFailures.incrementAndGet();
            log.error("Failed to launch worker {}", ordinal, e);
            scheduleRestart(ordinal);
            return CompletableFuture.completedFuture(null);
        }
        startedTotal.incrementAndGet();
        starting.put(ordinal, handle);

        handle.onExit().thenAccept(code -> onExit(handle, code));
        return handle.handshake()
                .orTimeout(settings.getStartupTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((message, error) -> {
                    if (error != null) {
                        onStartupFailure(handle, error);
                    } else {
                        onStarted(handle, message);
                    }
                    return null;
                });
    }

    private void onStarted(WorkerHandle handle, IpcMessage message) {
        if (!starting.remove(handle.ordinal(), handle)) {
            return;
        }
        if (stopping) {
            handle.terminate();
            return;
        }
        registry.register(handle);
        nextBackoff.remove(handle.ordinal());
        log.info("Worker {} started with pid {}", handle.ordinal(), message.pid());
    }

    private void onStartupFailure(WorkerHandle handle, Throwable error) {
        if (!starting.remove(handle.ordinal(), handle)) {
            return;
        }
        startupFailures.incrementAndGet();
        if (stopping) {
            handle.kill();
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof TimeoutException) {
            log.error("Worker {} (pid {}) did not complete its handshake within {}; killing it",
                    handle.ordinal(), handle.pid(), settings.getStartupTimeout());
        } else {
            log.error("Worker {} (pid {}) failed to start: {}", handle.ordinal(), handle.pid(), cause.getMessage());
        }
        handle.kill();
        scheduleRestart(handle.ordinal());
    }

    private void onExit(WorkerHandle handle, Integer code) {
        if (stopping) {
            registry.remove(handle);
            starting.remove(handle.ordinal(), handle);
            log.debug("Worker {} (pid {}) exited with code {}", handle.ordinal(), handle.pid(), code);
            return;
        }
        if (starting.remove(handle.ordinal(), handle)) {
            startupFailures.incrementAndGet();
            log.error("Worker {} (pid {}) exited with code {} before completing its handshake",
                    handle.ordinal(), handle.pid(), code);
            scheduleRestart(handle.ordinal());
            return;
        }
        if (registry.remove(handle)) {
            unexpectedExits.incrementAndGet();
            log.warn("Worker {} (pid {}) exited unexpectedly with code {}", handle.ordinal(), handle.pid(), code);
            scheduleRestart(handle.ordinal());
        }
    }

    private void scheduleRestart(int ordinal) {
        if (stopping) {
            return;
        }
        Duration delay = nextBackoff.getOrDefault(ordinal, settings.getRestartBackoffInitial());
        Duration doubled = delay.multipliedBy(2);
        Duration max = settings.getRestartBackoffMax();
        nextBackoff.put(ordinal, doubled.compareTo(max) > 0 ? max : doubled);
        restarts.incrementAndGet();
        log.info("Restarting worker {} in {}", ordinal, delay);
        try {
            restartScheduler.schedule(() -> restart(ordinal), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Restart of worker {} rejected; supervisor is shutting down", ordinal);
        }
    }

    private void restart(int ordinal) {
        try {
            spawn(ordinal);
        } catch (RuntimeException e) {
            startupFailures.incrementAndGet();
            log.error("Failed to restart worker {}", ordinal, e);
            scheduleRestart(ordinal);
        }
    }

    /**
     * Terminates every worker, escalating to a kill for those still alive after the shutdown timeout.
     */
    @Override
    public void stop() {
        if (!running) {
            return;
        }
        stopping = true;
        running = false;
        restartScheduler.shutdownNow();

        List<WorkerHandle> workers = new ArrayList<>(registry.list());
        workers.addAll(starting.values());
        if (!workers.isEmpty()) {
            log.info("Stopping {} worker(s)", workers.size());
            for (WorkerHandle worker : workers) {
                worker.terminate();
            }
            List<WorkerHandle> stragglers = awaitExit(workers, settings.getShutdownTimeout());
            for (WorkerHandle straggler : stragglers) {
                log.warn("Worker {} (pid {}) did not exit within {}; killing it", straggler.ordinal(),
                        straggler.pid(), settings.getShutdownTimeout());
                straggler.kill();
            }
            List<WorkerHandle> survivors = awaitExit(stragglers, settings.getShutdownTimeout());
            for (WorkerHandle survivor : survivors) {
                log.error("Worker {} (pid {}) is still alive after being killed", survivor.ordinal(), survivor.pid());
            }
            for (WorkerHandle worker : workers) {
                if (!survivors.contains(worker)) {
                    registry.remove(worker);
                    starting.remove(worker.ordinal(), worker);
                }
            }
        }

        if (registry.size() == 0 && starting.isEmpty()) {
            log.info("Worker pool shut down");
        } else {
            log.warn("Worker pool stopped with {} worker(s) still registered", registry.size() + starting.size());
        }
    }

    private List<WorkerHandle> awaitExit(List<WorkerHandle> workers, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<WorkerHandle> remaining = new ArrayList<>();
        for (WorkerHandle worker : workers) {
            long waitNanos = Math.max(0L, deadline - System.nanoTime());
            try {
                worker.onExit().get(waitNanos, TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                remaining.add(worker);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                remaining.add(worker);
            } catch (ExecutionException e) {
                log.debug("Exit of worker {} completed exceptionally", worker.ordinal(), e);
            }
        }
        return remaining;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }

    public Set<Long> livePids() {
        return registry.pids();
    }

    public WorkerPoolHealth health() {
        return new WorkerPoolHealth(configuredCount, registry.size(), startedTotal.get(), restarts.get(),
                startupFailures.get(), unexpectedExits.get());
    }
}
