package com.workq.internal;

import com.workq.JobContext;
import com.workq.JobHandler;
import com.workq.JobStore;
import com.workq.annotation.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Garbage collector of finished jobs. Deletes every finished, non-persistent job whose
 * {@code remove_at} has passed, except the running collection job itself.
 */
@Job(value = RemoveOldJobsHandler.JOB_TYPE,
        cron = "${workq.cleanup.cron:0 * * * * *}",
        autoRescheduleOnFailure = true,
        autoRescheduleOnFailureDelay = "${workq.cleanup.retry-delay:1m}")
public class RemoveOldJobsHandler implements JobHandler<RemoveOldJobsPayload> {

    public static final String JOB_TYPE = "removeOldWorkerJobs";

    private static final Logger log = LoggerFactory.getLogger(RemoveOldJobsHandler.class);

    private final JobStore jobStore;

    public RemoveOldJobsHandler(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    @Override
    public Object process(JobContext context, RemoveOldJobsPayload payload) {
        RemoveOldJobsPayload exclusions = payload == null ? RemoveOldJobsPayload.none() : payload;
        Set<Long> excludedIds = new LinkedHashSet<>(exclusions.excludeIds());
        excludedIds.add(context.jobId());

        int deleted = jobStore.deleteRemovable(excludedIds, exclusions.excludeTags());
        if (deleted > 0) {
            log.info("Removed {} finished job(s)", deleted);
        }
        return Map.of("deleted", deleted);
    }
}
