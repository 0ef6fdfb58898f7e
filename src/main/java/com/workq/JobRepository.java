package com.workq;

import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Aggregated lifecycle counters fetched in a single query.
     */
    interface LifecycleCounts {
        Long getPendingCount();

        Long getRunningCount();

        Long getSucceededCount();

        Long getFailedCount();
    }

    @Query("""
            SELECT COUNT(j) FROM Job j
            WHERE j.started IS NULL
              AND j.finished IS NULL
            """)
    long countPendingJobs();

    Optional<Job> findFirstByStartedIsNullAndFinishedIsNullOrderByDueAscIdAsc();

    boolean existsByTagAndTypeAndCronScheduleAndStartedIsNullAndFinishedIsNull(String tag, String type,
            String cronSchedule);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findByTagOrderByIdAsc(String tag);

    List<Job> findByStartedLessThanEqualAndFinishedIsNullOrderByStartedAscIdAsc(OffsetDateTime startedBefore);

    @QueryHints(@QueryHint(name = "org.hibernate.readOnly", value = "true"))
    List<Job> findByRescheduledFromJob(Long rescheduledFromJob);

    @Query("""
            SELECT
              COALESCE(SUM(CASE
                WHEN j.started IS NULL AND j.finished IS NULL
                THEN 1 ELSE 0 END), 0) AS pendingCount,
              COALESCE(SUM(CASE
                WHEN j.started IS NOT NULL AND j.finished IS NULL
                THEN 1 ELSE 0 END), 0) AS runningCount,
              COALESCE(SUM(CASE
                WHEN j.finished IS NOT NULL AND j.success = true
                THEN 1 ELSE 0 END), 0) AS succeededCount,
              COALESCE(SUM(CASE
                WHEN j.finished IS NOT NULL AND (j.success IS NULL OR j.success = false)
                THEN 1 ELSE 0 END), 0) AS failedCount
            FROM Job j
            """)
    LifecycleCounts countLifecycleCounts();
}
