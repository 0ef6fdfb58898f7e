package com.workq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.workq.Job;
import com.workq.JobResults;
import com.workq.JobStore;
import com.workq.config.WorkQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Fails jobs whose worker disappeared mid-execution. A row that has been running for longer than
 * {@code workq.jobs.stale-claim-timeout} is finished as failed and handed to the {@link ReschedulePolicy},
 * so retries and cron chains continue. The claim itself is never undone.
 */
public class StaleJobReaper {

    private static final Logger log = LoggerFactory.getLogger(StaleJobReaper.class);

    private final JobStore jobStore;
    private final ReschedulePolicy reschedulePolicy;
    private final WorkQProperties properties;
    private final Clock clock;

    public StaleJobReaper(JobStore jobStore, ReschedulePolicy reschedulePolicy, WorkQProperties properties,
            Clock clock) {
        this.jobStore = jobStore;
        this.reschedulePolicy = reschedulePolicy;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${workq.jobs.stale-check-interval-in-seconds:60}000",
            initialDelayString = "${workq.jobs.stale-check-interval-in-seconds:60}000")
    public void scheduledReap() {
        try {
            reapStale();
        } catch (RuntimeException e) {
            log.error("Failed to reap stale jobs", e);
        }
    }

    /**
     * @return the number of jobs that were abandoned
     */
    public int reapStale() {
        Duration timeout = properties.getJobs().getStaleClaimTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return 0;
        }
        OffsetDateTime startedBefore = OffsetDateTime.now(clock).minus(timeout);
        List<Job> stale = jobStore.findStale(startedBefore);
        if (stale.isEmpty()) {
            return 0;
        }
        JsonNode result = JobResults.error(JobResults.ABANDONED_PREFIX + "running for longer than " + timeout);
        List<Long> abandoned = new ArrayList<>();
        for (Job job : stale) {
            try {
                if (reschedulePolicy.complete(job, false, result)) {
                    abandoned.add(job.getId());
                }
            } catch (RuntimeException e) {
                log.error("Failed to abandon stale job {}", job.getId(), e);
            }
        }
        if (!abandoned.isEmpty()) {
            log.warn("Abandoned {} job(s) running since before {}: {}", abandoned.size(), startedBefore, abandoned);
        }
        return abandoned.size();
    }
}
