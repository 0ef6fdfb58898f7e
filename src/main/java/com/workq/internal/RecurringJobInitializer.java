package com.workq.internal;

import com.workq.Job;
import com.workq.JobRequest;
import com.workq.JobScheduler;
import com.workq.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bootstraps recurring jobs defined via {@code @Job(cron = "...")} when the supervisor starts.
 * A recurrence that is already pending with the same schedule is left alone; anything else on its tag
 * is replaced, since no worker is running yet that could own it.
 */
public class RecurringJobInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(RecurringJobInitializer.class);
    static final String DEFAULT_TAG_PREFIX = "cron:";

    private final JobHandlerRegistry registry;
    private final JobScheduler jobScheduler;
    private final JobStore jobStore;
    private final Environment environment;
    private volatile boolean running = false;

    public RecurringJobInitializer(JobHandlerRegistry registry, JobScheduler jobScheduler, JobStore jobStore,
            Environment environment) {
        this.registry = registry;
        this.jobScheduler = jobScheduler;
        this.jobStore = jobStore;
        this.environment = environment;
    }

    @Override
    public void start() {
        log.info("Checking for recurring jobs to bootstrap...");
        for (RecurringDefinition definition : recurringDefinitions()) {
            bootstrap(definition);
        }
        this.running = true;
    }

    /**
     * Resolves the recurring definitions of all registered handlers. Placeholders are resolved against
     * the environment and every expression is validated.
     */
    List<RecurringDefinition> recurringDefinitions() {
        List<RecurringDefinition> definitions = new ArrayList<>();
        for (JobHandlerRegistry.RegisteredHandler registration : registry.all()) {
            com.workq.annotation.Job annotation = registration.annotation();
            if (annotation == null || annotation.cron().isBlank()) {
                continue;
            }
            String type = registration.type();
            String cron = environment.resolveRequiredPlaceholders(annotation.cron()).trim();
            try {
                CronSchedules.parse(cron);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                        "Invalid cron expression '" + cron + "' for job type '" + type + "'", e);
            }
            String tag = annotation.tag().isBlank()
                    ? DEFAULT_TAG_PREFIX + type
                    : environment.resolveRequiredPlaceholders(annotation.tag()).trim();

            JobRequest.Builder request = JobRequest.builder(tag, type)
                    .removeDelay(parseDuration(annotation.removeDelay(), type, "removeDelay"))
                    .persistent(annotation.persistent());
            if (annotation.autoRescheduleOnFailure()) {
                Duration retryDelay = parseDuration(annotation.autoRescheduleOnFailureDelay(), type,
                        "autoRescheduleOnFailureDelay");
                request.autoRescheduleOnFailure(retryDelay == null ? Duration.ZERO : retryDelay);
            }
            definitions.add(new RecurringDefinition(type, tag, cron, request.build()));
        }
        return definitions;
    }

    private void bootstrap(RecurringDefinition definition) {
        try {
            if (jobStore.hasPendingRecurrence(definition.tag(), definition.type(), definition.cron())) {
                log.debug("Recurring job {} already has a pending execution on tag {}", definition.type(),
                        definition.tag());
                return;
            }
            Job job = jobScheduler.scheduleCronJob(definition.request(), definition.cron());
            log.info("Bootstrapped recurring job {} with cron '{}' on tag {}. First execution scheduled at {}",
                    definition.type(), definition.cron(), definition.tag(), job.getDue());
        } catch (RuntimeException e) {
            log.error("Failed to bootstrap recurring job {} with cron '{}'", definition.type(), definition.cron(), e);
        }
    }

    private Duration parseDuration(String value, String type, String attribute) {
        String resolved = environment.resolveRequiredPlaceholders(value).trim();
        if (resolved.isEmpty()) {
            return null;
        }
        try {
            return DurationStyle.detectAndParse(resolved);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(
                    "Invalid " + attribute + " '" + resolved + "' on @Job of type '" + type + "'", e);
        }
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // Start last
    }

    record RecurringDefinition(String type, String tag, String cron, JobRequest request) {
    }
}
