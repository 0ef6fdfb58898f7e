package com.workq.internal;

import com.workq.JobRepository;
import com.workq.JobStatus;
import com.workq.process.WorkerSupervisor;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class WorkQMetrics {

    private static final Logger log = LoggerFactory.getLogger(WorkQMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final WorkerSupervisor workerSupervisor;
    private final Object snapshotMonitor = new Object();

    private volatile LifecycleSnapshot cachedSnapshot = LifecycleSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean snapshotLoaded = false;

    /**
     * @param workerSupervisor the supervisor of this process, or {@code null} inside a worker process
     */
    public WorkQMetrics(JobRepository jobRepository, MeterRegistry meterRegistry, WorkerSupervisor workerSupervisor) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
        this.workerSupervisor = workerSupervisor;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering WorkQ gauges...");

        for (JobStatus status : JobStatus.values()) {
            Gauge.builder("workq.jobs.count", this, metrics -> metrics.countFor(status))
                    .description("Number of WorkQ jobs")
                    .tag("status", status.name())
                    .register(meterRegistry);
        }

        Gauge.builder("workq.jobs.total", this, WorkQMetrics::totalCount)
                .description("Total number of WorkQ jobs in the database")
                .register(meterRegistry);

        if (workerSupervisor != null) {
            Gauge.builder("workq.workers.live", workerSupervisor, supervisor -> supervisor.health().live())
                    .description("Number of worker processes that completed their startup handshake")
                    .register(meterRegistry);
        }
    }

    private double countFor(JobStatus status) {
        LifecycleSnapshot snapshot = getSnapshot();
        return switch (status) {
            case PENDING -> snapshot.pendingCount();
            case RUNNING -> snapshot.runningCount();
            case SUCCEEDED -> snapshot.succeededCount();
            case FAILED -> snapshot.failedCount();
        };
    }

    private double totalCount() {
        LifecycleSnapshot snapshot = getSnapshot();
        return snapshot.pendingCount() + snapshot.runningCount() + snapshot.succeededCount() + snapshot.failedCount();
    }

    private LifecycleSnapshot getSnapshot() {
        long now = System.nanoTime();
        LifecycleSnapshot currentSnapshot = cachedSnapshot;
        if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return currentSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (snapshotLoaded && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            snapshotLoaded = true;
            return cachedSnapshot;
        }
    }

    private LifecycleSnapshot loadSnapshot() {
        try {
            JobRepository.LifecycleCounts counts = jobRepository.countLifecycleCounts();
            return new LifecycleSnapshot(
                    countOrZero(counts.getPendingCount()),
                    countOrZero(counts.getRunningCount()),
                    countOrZero(counts.getSucceededCount()),
                    countOrZero(counts.getFailedCount()));
        } catch (Exception e) {
            log.trace("Failed to query lifecycle counts for metrics: {}", e.getMessage());
            return LifecycleSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private record LifecycleSnapshot(
            long pendingCount,
            long runningCount,
            long succeededCount,
            long failedCount) {
        private static LifecycleSnapshot empty() {
            return new LifecycleSnapshot(0, 0, 0, 0);
        }
    }
}
