package com.workq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.workq.config.WorkQProperties;
import com.workq.internal.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for scheduling work. Scheduling a job cancels every unfinished job with the same tag in
 * the same transaction, so at most one job per tag is ever waiting to run. Writers of a tag are
 * serialized through {@link JobStore#lockTag(String)}.
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final JobStore jobStore;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final WorkQProperties properties;
    private final Clock clock;

    public JobScheduler(JobStore jobStore, ObjectMapper objectMapper, TransactionTemplate transactionTemplate,
            WorkQProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.objectMapper = objectMapper;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Schedule a job that is due immediately.
     */
    public Job scheduleJob(String tag, String type, Object data) {
        return scheduleJob(JobRequest.of(tag, type, data));
    }

    /**
     * Schedule a job on behalf of a user that is due immediately.
     */
    public Job scheduleJob(String tag, String type, Long userId, Object data) {
        return scheduleJob(JobRequest.builder(tag, type).userId(userId).data(data).build());
    }

    /**
     * Cancels the unfinished jobs of the request's tag and inserts the new job, atomically.
     */
    public Job scheduleJob(JobRequest request) {
        Job job = newJob(request, null);
        OffsetDateTime now = now();
        job.setDue(request.getDue() != null ? request.getDue() : now);
        job.setRemoveAt(job.getDue().plus(Duration.ofMillis(job.getRemoveDelay())));
        return replaceOnTag(job);
    }

    /**
     * Like {@link #scheduleJob(JobRequest)}, but due at the first fire time of {@code cronExpression} on or
     * after now.
     * Each successful or failed execution schedules the following occurrence on the same tag.
     */
    public Job scheduleCronJob(JobRequest request, String cronExpression) {
        String cron = normalizeCron(cronExpression);
        Job job = newJob(request, cron);
        OffsetDateTime due = CronSchedules.nextOnOrAfter(cron, now())
                .orElseThrow(() -> new IllegalArgumentException(
                        "Cron expression '" + cron + "' has no future fire time"));
        job.setDue(due);
        job.setRemoveAt(due.plus(Duration.ofMillis(job.getRemoveDelay())));
        return replaceOnTag(job);
    }

    /**
     * Schedules the next occurrence of a recurring job, strictly after its due time and never in the past.
     *
     * @return the successor, or empty if the job is not recurring or its expression never fires again
     */
    public Optional<Job> rescheduleCronJob(Job job) {
        Objects.requireNonNull(job, "job");
        if (!job.isRecurring()) {
            return Optional.empty();
        }
        return CronSchedules.nextOccurrence(job.getCronSchedule(), job.getDue(), now())
                .flatMap(due -> scheduleSuccessor(job, due));
    }

    /**
     * Schedules a copy of {@code predecessor} due at {@code due}, linked through {@code rescheduledFromJob}.
     * A successor never cancels anything: if the tag already has an unfinished job, that job was scheduled
     * after the predecessor finished and takes precedence.
     *
     * @return the successor, or empty if the tag was taken meanwhile
     */
    public Optional<Job> scheduleSuccessor(Job predecessor, OffsetDateTime due) {
        Objects.requireNonNull(predecessor, "predecessor");
        Objects.requireNonNull(due, "due");
        Job successor = new Job(predecessor.getTag(), predecessor.getType(), predecessor.getUserId(),
                predecessor.getData(), due);
        successor.setCronSchedule(predecessor.getCronSchedule());
        successor.setAutoRescheduleOnFailure(predecessor.isAutoRescheduleOnFailure());
        successor.setAutoRescheduleOnFailureDelay(predecessor.getAutoRescheduleOnFailureDelay());
        successor.setRemoveDelay(predecessor.getRemoveDelay());
        successor.setRemoveAt(due.plus(Duration.ofMillis(predecessor.getRemoveDelay())));
        successor.setPersistent(predecessor.isPersistent());
        successor.setRescheduledFromJob(predecessor.getId());
        return inTagTransaction(successor.getTag(), () -> {
            if (jobStore.hasUnfinished(successor.getTag())) {
                log.info("Skipped successor of job {}: tag {} already has an unfinished job", predecessor.getId(),
                        successor.getTag());
                return Optional.<Job>empty();
            }
            Job saved = jobStore.insert(successor);
            log.debug("Scheduled successor {} of job {} on tag {} due at {}", saved.getId(), predecessor.getId(),
                    saved.getTag(), due);
            return Optional.of(saved);
        });
    }

    /**
     * Runs {@code work} in a transaction that holds the lock of {@code tag}. Joins the caller's
     * transaction if there is one.
     */
    public <T> T inTagTransaction(String tag, Supplier<T> work) {
        return transactionTemplate.execute(status -> {
            jobStore.lockTag(tag);
            return work.get();
        });
    }

    public long getTotalPendingJobs() {
        return jobStore.countPending();
    }

    public Optional<Job> getNextPendingJob() {
        return jobStore.findNextPending();
    }

    public Optional<Job> getJobById(long id) {
        return jobStore.findById(id);
    }

    public List<Job> getJobsByTag(String tag) {
        return jobStore.findByTag(normalizeRequired(tag, "tag"));
    }

    private Job replaceOnTag(Job job) {
        return inTagTransaction(job.getTag(), () -> {
            jobStore.cancelPendingByTag(job.getTag());
            return jobStore.insert(job);
        });
    }

    private Job newJob(JobRequest request, String cronSchedule) {
        Objects.requireNonNull(request, "request");
        String tag = normalizeRequired(request.getTag(), "tag");
        String type = normalizeRequired(request.getType(), "type");
        long removeDelayMs = resolveRemoveDelayMs(request.getRemoveDelay());
        long retryDelayMs = toNonNegativeMillis(request.getAutoRescheduleOnFailureDelay(),
                "autoRescheduleOnFailureDelay");

        Job job = new Job(tag, type, request.getUserId(), toJson(request.getData()), null);
        job.setCronSchedule(cronSchedule);
        job.setAutoRescheduleOnFailure(request.isAutoRescheduleOnFailure());
        job.setAutoRescheduleOnFailureDelay(retryDelayMs);
        job.setRemoveDelay(removeDelayMs);
        job.setPersistent(request.isPersistent());
        return job;
    }

    private long resolveRemoveDelayMs(Duration requested) {
        long removeDelayMs = toNonNegativeMillis(requested, "removeDelay");
        if (removeDelayMs > 0) {
            return removeDelayMs;
        }
        return toNonNegativeMillis(properties.getJobs().getDefaultRemoveDelay(), "workq.jobs.default-remove-delay");
    }

    private long toNonNegativeMillis(Duration duration, String name) {
        if (duration == null) {
            return 0L;
        }
        if (duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return duration.toMillis();
    }

    private JsonNode toJson(Object data) {
        if (data == null) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (data instanceof JsonNode node) {
            return node.isNull() ? JsonNodeFactory.instance.objectNode() : node;
        }
        return objectMapper.valueToTree(data);
    }

    private String normalizeCron(String cronExpression) {
        String cron = normalizeRequired(cronExpression, "cronExpression");
        CronSchedules.parse(cron);
        return cron;
    }

    private String normalizeRequired(String value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("Job " + name + " must not be null");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Job " + name + " must not be blank");
        }
        return trimmed;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
