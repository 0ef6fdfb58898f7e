package com.workq;

import java.time.OffsetDateTime;

/**
 * Identity of the job handed to {@link JobHandler#process(JobContext, Object)}.
 */
public record JobContext(
        long jobId,
        String tag,
        String type,
        Long userId,
        OffsetDateTime due,
        Long rescheduledFromJob) {

    public static JobContext of(Job job) {
        return new JobContext(job.getId(), job.getTag(), job.getType(), job.getUserId(), job.getDue(),
                job.getRescheduledFromJob());
    }
}
