package com.workq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.workq.Job;
import com.workq.JobScheduler;
import com.workq.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Decides whether a finished job gets a successor on its tag.
 * <p>
 * A failed job with {@code autoRescheduleOnFailure} is retried after its delay. A recurring job is
 * followed by its next cron occurrence whatever the outcome. When both apply only the earlier one is
 * scheduled; the successor keeps the cron schedule either way, so the chain continues.
 */
public class ReschedulePolicy {

    private static final Logger log = LoggerFactory.getLogger(ReschedulePolicy.class);

    private final JobScheduler jobScheduler;
    private final JobStore jobStore;
    private final Clock clock;

    public ReschedulePolicy(JobScheduler jobScheduler, JobStore jobStore, Clock clock) {
        this.jobScheduler = jobScheduler;
        this.jobStore = jobStore;
        this.clock = clock;
    }

    /**
     * Records the outcome of a running job and schedules its successor in one transaction holding the
     * job's tag lock. If the recording or the successor insert fails, neither is kept and the job stays
     * running.
     *
     * @return {@code false} if the row was no longer running, in which case no successor is scheduled
     */
    public boolean complete(Job job, boolean success, JsonNode result) {
        Boolean recorded = jobScheduler.inTagTransaction(job.getTag(), () -> {
            if (!jobStore.markFinished(job.getId(), success, result)) {
                return false;
            }
            apply(job, success);
            return true;
        });
        return Boolean.TRUE.equals(recorded);
    }

    /**
     * Due time of the successor of {@code job}, or empty if none is needed.
     */
    public Optional<OffsetDateTime> successorDue(Job job, boolean success, OffsetDateTime now) {
        OffsetDateTime retryDue = null;
        if (!success && job.isAutoRescheduleOnFailure()) {
            retryDue = now.plus(Duration.ofMillis(job.getAutoRescheduleOnFailureDelay()));
        }

        OffsetDateTime cronDue = null;
        if (job.isRecurring()) {
            try {
                cronDue = CronSchedules.nextOccurrence(job.getCronSchedule(), job.getDue(), now).orElse(null);
            } catch (IllegalArgumentException invalidCron) {
                log.error("Job {} carries an invalid cron schedule '{}'; the chain ends here", job.getId(),
                        job.getCronSchedule(), invalidCron);
            }
        }

        if (retryDue == null) {
            return Optional.ofNullable(cronDue);
        }
        if (cronDue == null) {
            return Optional.of(retryDue);
        }
        return Optional.of(cronDue.isBefore(retryDue) ? cronDue : retryDue);
    }

    /**
     * Schedules the successor of a job whose outcome has just been recorded.
     */
    public Optional<Job> apply(Job job, boolean success) {
        Optional<OffsetDateTime> due = successorDue(job, success, OffsetDateTime.now(clock));
        if (due.isEmpty()) {
            return Optional.empty();
        }
        Optional<Job> successor = jobScheduler.scheduleSuccessor(job, due.get());
        successor.ifPresent(next -> {
            if (success) {
                log.debug("Rescheduled recurring job {} of type {} as {} at {}", job.getId(), job.getType(),
                        next.getId(), next.getDue());
            } else {
                log.info("Rescheduled failed job {} of type {} as {} at {}", job.getId(), job.getType(),
                        next.getId(), next.getDue());
            }
        });
        return successor;
    }
}
