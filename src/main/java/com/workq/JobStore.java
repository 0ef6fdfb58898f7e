package com.workq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.workq.config.WorkQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Array;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Durable storage of jobs. Every state transition is a single conditional statement so that
 * concurrent workers, cancellations and the garbage collector can never move a row backwards.
 */
public class JobStore {

    private static final Logger log = LoggerFactory.getLogger(JobStore.class);
    private static final Pattern SAFE_TABLE_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private final JobRepository jobRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final String jobTableName;
    private final String claimNextSql;
    private final String markFinishedSql;
    private final String cancelByTagSql;
    private final String deleteRemovableSql;
    private final String lockTagSql;
    private final String hasUnfinishedSql;

    public JobStore(JobRepository jobRepository, JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
            WorkQProperties properties, Clock clock) {
        this.jobRepository = jobRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
        this.jobTableName = resolveJobTableName(properties.getDatabase().getTablePrefix());
        this.claimNextSql = buildClaimNextSql(jobTableName);
        this.markFinishedSql = """
                UPDATE %s
                SET finished = ?, success = ?, result = CAST(? AS jsonb), updated_at = ?
                WHERE id = ?
                  AND started IS NOT NULL
                  AND finished IS NULL
                """.formatted(jobTableName);
        this.cancelByTagSql = """
                UPDATE %s
                SET started = COALESCE(started, ?), finished = ?, success = false,
                    result = CAST(? AS jsonb), updated_at = ?
                WHERE tag = ?
                  AND finished IS NULL
                """.formatted(jobTableName);
        this.deleteRemovableSql = """
                DELETE FROM %s
                WHERE finished IS NOT NULL
                  AND persistent = false
                  AND remove_at <= ?
                  AND NOT (id = ANY (?))
                  AND NOT (tag = ANY (?))
                """.formatted(jobTableName);
        // Two-key form: keeps tag locks apart from the single-key schema migration lock.
        this.lockTagSql = "SELECT pg_advisory_xact_lock(hashtext(?), hashtext(?))";
        this.hasUnfinishedSql = "SELECT EXISTS (SELECT 1 FROM %s WHERE tag = ? AND finished IS NULL)"
                .formatted(jobTableName);
    }

    /**
     * Inserts a new job row. Callers are expected to have filled every non-null column.
     */
    public Job insert(Job job) {
        Objects.requireNonNull(job, "job");
        if (job.getId() != null) {
            throw new IllegalArgumentException("Job " + job.getId() + " is already persisted");
        }
        OffsetDateTime now = now();
        if (job.getData() == null) {
            job.setData(JsonNodeFactory.instance.objectNode());
        }
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        Job saved = jobRepository.save(job);
        log.debug("Inserted job {} of type {} on tag {} due at {}", saved.getId(), saved.getType(), saved.getTag(),
                saved.getDue());
        return saved;
    }

    /**
     * Atomically claims the oldest due, unstarted and unfinished job. Concurrent callers never receive
     * the same row: the candidate is locked with {@code SKIP LOCKED} and the update re-checks that it is
     * still unclaimed.
     */
    public Optional<Job> claimNext() {
        Optional<Job> claimed = transactionTemplate.execute(status -> {
            OffsetDateTime now = now();
            Long claimedId = jdbcTemplate.query(
                    claimNextSql,
                    ps -> {
                        ps.setObject(1, now);
                        ps.setObject(2, now);
                        ps.setObject(3, now);
                    },
                    rs -> rs.next() ? rs.getLong(1) : null);
            if (claimedId == null) {
                return Optional.<Job>empty();
            }
            return jobRepository.findById(claimedId);
        });
        return claimed == null ? Optional.empty() : claimed;
    }

    /**
     * Records the outcome of a claimed job.
     *
     * @return {@code false} if the row was no longer running, for example because a newer job on the
     *         same tag cancelled it while it was executing
     */
    public boolean markFinished(long id, boolean success, JsonNode result) {
        OffsetDateTime now = now();
        String resultJson = result == null || result.isNull() ? null : result.toString();
        int updated = jdbcTemplate.update(markFinishedSql, ps -> {
            ps.setObject(1, now);
            ps.setBoolean(2, success);
            ps.setString(3, resultJson);
            ps.setObject(4, now);
            ps.setLong(5, id);
        });
        return updated > 0;
    }

    /**
     * Finishes every unfinished job of the tag as a failed cancellation.
     *
     * @return the number of cancelled rows
     */
    public int cancelPendingByTag(String tag) {
        OffsetDateTime now = now();
        String resultJson = JobResults.cancelled().toString();
        int cancelled = jdbcTemplate.update(cancelByTagSql, ps -> {
            ps.setObject(1, now);
            ps.setObject(2, now);
            ps.setString(3, resultJson);
            ps.setObject(4, now);
            ps.setString(5, tag);
        });
        if (cancelled > 0) {
            log.debug("Cancelled {} unfinished job(s) on tag {}", cancelled, tag);
        }
        return cancelled;
    }

    /**
     * Deletes finished, non-persistent jobs whose {@code remove_at} has passed.
     *
     * @return the number of deleted rows
     */
    public int deleteRemovable(Collection<Long> excludedIds, Collection<String> excludedTags) {
        OffsetDateTime now = now();
        Long[] ids = excludedIds == null ? new Long[0] : excludedIds.toArray(Long[]::new);
        String[] tags = excludedTags == null ? new String[0] : excludedTags.toArray(String[]::new);
        return jdbcTemplate.update(deleteRemovableSql, ps -> {
            Array idArray = ps.getConnection().createArrayOf("bigint", ids);
            Array tagArray = ps.getConnection().createArrayOf("text", tags);
            ps.setObject(1, now);
            ps.setArray(2, idArray);
            ps.setArray(3, tagArray);
        });
    }

    /**
     * Serializes every writer of {@code tag} until the surrounding transaction ends. Must be called
     * inside a transaction; the lock is reentrant within it.
     */
    public void lockTag(String tag) {
        jdbcTemplate.query(lockTagSql, ps -> {
            ps.setString(1, jobTableName);
            ps.setString(2, tag);
        }, rs -> null);
    }

    public boolean hasUnfinished(String tag) {
        Boolean exists = jdbcTemplate.queryForObject(hasUnfinishedSql, Boolean.class, tag);
        return Boolean.TRUE.equals(exists);
    }

    /**
     * Running jobs claimed at or before {@code startedBefore}, oldest claim first.
     */
    public List<Job> findStale(OffsetDateTime startedBefore) {
        return jobRepository.findByStartedLessThanEqualAndFinishedIsNullOrderByStartedAscIdAsc(startedBefore);
    }

    public Optional<Job> findById(long id) {
        return jobRepository.findById(id);
    }

    public List<Job> findByTag(String tag) {
        return jobRepository.findByTagOrderByIdAsc(tag);
    }

    public List<Job> findSuccessorsOf(long id) {
        return jobRepository.findByRescheduledFromJob(id);
    }

    public long countPending() {
        return jobRepository.countPendingJobs();
    }

    public Optional<Job> findNextPending() {
        return jobRepository.findFirstByStartedIsNullAndFinishedIsNullOrderByDueAscIdAsc();
    }

    public boolean hasPendingRecurrence(String tag, String type, String cronSchedule) {
        return jobRepository.existsByTagAndTypeAndCronScheduleAndStartedIsNullAndFinishedIsNull(tag, type,
                cronSchedule);
    }

    public String getJobTableName() {
        return jobTableName;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    private static String buildClaimNextSql(String tableName) {
        return """
                UPDATE %1$s
                SET started = ?, updated_at = ?
                WHERE id = (
                    SELECT id FROM %1$s
                    WHERE started IS NULL
                      AND finished IS NULL
                      AND due <= ?
                    ORDER BY due ASC, id ASC
                    LIMIT 1
                    FOR UPDATE SKIP LOCKED
                )
                  AND started IS NULL
                  AND finished IS NULL
                RETURNING id
                """.formatted(tableName);
    }

    private static String resolveJobTableName(String tablePrefix) {
        String prefix = tablePrefix == null ? "" : tablePrefix.trim();
        String tableName = prefix + "workq_jobs";
        if (!SAFE_TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Unsupported job table name: " + tableName);
        }
        return tableName;
    }
}
