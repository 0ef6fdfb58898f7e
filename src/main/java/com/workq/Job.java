package com.workq;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;

@Entity
@Table(name = "workq_jobs")
public class Job {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tag;

    @Column(nullable = false)
    private String type;

    @Column(name = "user_id")
    private Long userId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb", nullable = false)
    private JsonNode data;

    @Column(nullable = false)
    private OffsetDateTime due;

    @Column(name = "started")
    private OffsetDateTime started;

    @Column(name = "finished")
    private OffsetDateTime finished;

    @Column(name = "success")
    private Boolean success;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "jsonb")
    private JsonNode result;

    @Column(name = "cron_schedule")
    private String cronSchedule;

    @Column(name = "auto_reschedule_on_failure", nullable = false)
    private boolean autoRescheduleOnFailure;

    @Column(name = "auto_reschedule_on_failure_delay", nullable = false)
    private long autoRescheduleOnFailureDelay;

    @Column(name = "remove_delay", nullable = false)
    private long removeDelay;

    @Column(name = "remove_at", nullable = false)
    private OffsetDateTime removeAt;

    @Column(name = "rescheduled_from_job")
    private Long rescheduledFromJob;

    @Column(name = "persistent", nullable = false)
    private boolean persistent;

    @Column(name = "created_at", updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    public Job() {
    }

    public Job(String tag, String type, Long userId, JsonNode data, OffsetDateTime due) {
        this.tag = tag;
        this.type = type;
        this.userId = userId;
        this.data = data;
        this.due = due;
    }

    /**
     * Lifecycle status derived from the audit columns. A cancelled job reports FAILED.
     */
    @Transient
    public JobStatus getStatus() {
        if (finished != null) {
            return Boolean.TRUE.equals(success) ? JobStatus.SUCCEEDED : JobStatus.FAILED;
        }
        if (started != null) {
            return JobStatus.RUNNING;
        }
        return JobStatus.PENDING;
    }

    @Transient
    public boolean isRecurring() {
        return cronSchedule != null && !cronSchedule.isBlank();
    }

    @Transient
    public boolean isSystemJob() {
        return userId == null || userId == 0L;
    }

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public JsonNode getData() {
        return data;
    }

    public void setData(JsonNode data) {
        this.data = data;
    }

    public OffsetDateTime getDue() {
        return due;
    }

    public void setDue(OffsetDateTime due) {
        this.due = due;
    }

    public OffsetDateTime getStarted() {
        return started;
    }

    public void setStarted(OffsetDateTime started) {
        this.started = started;
    }

    public OffsetDateTime getFinished() {
        return finished;
    }

    public void setFinished(OffsetDateTime finished) {
        this.finished = finished;
    }

    public Boolean getSuccess() {
        return success;
    }

    public void setSuccess(Boolean success) {
        this.success = success;
    }

    public JsonNode getResult() {
        return result;
    }

    public void setResult(JsonNode result) {
        this.result = result;
    }

    public String getCronSchedule() {
        return cronSchedule;
    }

    public void setCronSchedule(String cronSchedule) {
        this.cronSchedule = cronSchedule;
    }

    public boolean isAutoRescheduleOnFailure() {
        return autoRescheduleOnFailure;
    }

    public void setAutoRescheduleOnFailure(boolean autoRescheduleOnFailure) {
        this.autoRescheduleOnFailure = autoRescheduleOnFailure;
    }

    public long getAutoRescheduleOnFailureDelay() {
        return autoRescheduleOnFailureDelay;
    }

    public void setAutoRescheduleOnFailureDelay(long autoRescheduleOnFailureDelay) {
        this.autoRescheduleOnFailureDelay = autoRescheduleOnFailureDelay;
    }

    public long getRemoveDelay() {
        return removeDelay;
    }

    public void setRemoveDelay(long removeDelay) {
        this.removeDelay = removeDelay;
    }

    public OffsetDateTime getRemoveAt() {
        return removeAt;
    }

    public void setRemoveAt(OffsetDateTime removeAt) {
        this.removeAt = removeAt;
    }

    public Long getRescheduledFromJob() {
        return rescheduledFromJob;
    }

    public void setRescheduledFromJob(Long rescheduledFromJob) {
        this.rescheduledFromJob = rescheduledFromJob;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "Job[id=" + id + ", tag=" + tag + ", type=" + type + ", due=" + due + ", status=" + getStatus() + "]";
    }
}
