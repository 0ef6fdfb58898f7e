package com.workq.internal;

import com.workq.Job;
import com.workq.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The claim/execute/report loop run by every worker process. One loop executes one job at a time.
 * Store failures are logged and retried after the poll interval; they never end the loop.
 */
public class JobExecutionLoop implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobExecutionLoop.class);

    private final JobStore jobStore;
    private final JobExecutor jobExecutor;
    private final ReschedulePolicy reschedulePolicy;
    private final Sleeper sleeper;
    private final Duration pollInterval;

    private final AtomicLong processedJobs = new AtomicLong();
    private volatile LoopState state = LoopState.IDLE;
    private volatile boolean stopRequested = false;

    public JobExecutionLoop(JobStore jobStore, JobExecutor jobExecutor, ReschedulePolicy reschedulePolicy,
            Sleeper sleeper, Duration pollInterval) {
        this.jobStore = jobStore;
        this.jobExecutor = jobExecutor;
        this.reschedulePolicy = reschedulePolicy;
        this.sleeper = sleeper;
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
    }

    @Override
    public void run() {
        log.info("Job execution loop started with poll interval {}", pollInterval);
        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            runCycle();
        }
        state = LoopState.STOPPED;
        log.info("Job execution loop stopped after {} job(s)", processedJobs.get());
    }

    /**
     * Runs one cycle: claim a due job and execute it, or sleep for the poll interval if none is due.
     *
     * @return {@code true} if a job was executed
     */
    public boolean runCycle() {
        state = LoopState.POLLING;
        Optional<Job> claimed;
        try {
            claimed = jobStore.claimNext();
        } catch (RuntimeException e) {
            log.error("Failed to claim next job; retrying in {}", pollInterval, e);
            sleep();
            return false;
        }

        if (claimed.isEmpty()) {
            sleep();
            return false;
        }

        Job job = claimed.get();
        state = LoopState.CLAIMED;
        log.debug("Claimed job {} of type {} on tag {}", job.getId(), job.getType(), job.getTag());

        state = LoopState.RUNNING;
        JobOutcome outcome = jobExecutor.execute(job);

        state = LoopState.REPORTING;
        report(job, outcome);
        processedJobs.incrementAndGet();
        state = LoopState.IDLE;
        return true;
    }

    private void report(Job job, JobOutcome outcome) {
        boolean recorded;
        try {
            recorded = reschedulePolicy.complete(job, outcome.success(), outcome.result());
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of job {} of type {}; it stays running until reaped",
                    job.getId(), job.getType(), e);
            return;
        }
        if (!recorded) {
            log.info("Discarded outcome of job {} of type {}: it was finished by someone else while running",
                    job.getId(), job.getType());
        }
    }

    private void sleep() {
        state = LoopState.SLEEPING;
        try {
            sleeper.sleep(pollInterval);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopRequested = true;
        }
        state = LoopState.IDLE;
    }

    /**
     * Asks the loop to exit after the current cycle.
     */
    public void stop() {
        stopRequested = true;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public LoopState getState() {
        return state;
    }

    public long getProcessedJobs() {
        return processedJobs.get();
    }
}
