package com.workq;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Describes a job to schedule through {@link JobScheduler}.
 * Unset optional values fall back to the scheduler defaults: due now, the configured remove delay,
 * no automatic retry and not persistent.
 */
public final class JobRequest {

    private final String tag;
    private final String type;
    private final Long userId;
    private final Object data;
    private final OffsetDateTime due;
    private final Duration removeDelay;
    private final boolean autoRescheduleOnFailure;
    private final Duration autoRescheduleOnFailureDelay;
    private final boolean persistent;

    private JobRequest(Builder builder) {
        this.tag = builder.tag;
        this.type = builder.type;
        this.userId = builder.userId;
        this.data = builder.data;
        this.due = builder.due;
        this.removeDelay = builder.removeDelay;
        this.autoRescheduleOnFailure = builder.autoRescheduleOnFailure;
        this.autoRescheduleOnFailureDelay = builder.autoRescheduleOnFailureDelay;
        this.persistent = builder.persistent;
    }

    public static Builder builder(String tag, String type) {
        return new Builder(tag, type);
    }

    public static JobRequest of(String tag, String type, Object data) {
        return builder(tag, type).data(data).build();
    }

    public String getTag() {
        return tag;
    }

    public String getType() {
        return type;
    }

    public Long getUserId() {
        return userId;
    }

    public Object getData() {
        return data;
    }

    public OffsetDateTime getDue() {
        return due;
    }

    public Duration getRemoveDelay() {
        return removeDelay;
    }

    public boolean isAutoRescheduleOnFailure() {
        return autoRescheduleOnFailure;
    }

    public Duration getAutoRescheduleOnFailureDelay() {
        return autoRescheduleOnFailureDelay;
    }

    public boolean isPersistent() {
        return persistent;
    }

    @Override
    public String toString() {
        return "JobRequest[tag=" + tag + ", type=" + type + ", due=" + due + "]";
    }

    public static final class Builder {
        private final String tag;
        private final String type;
        private Long userId;
        private Object data;
        private OffsetDateTime due;
        private Duration removeDelay;
        private boolean autoRescheduleOnFailure;
        private Duration autoRescheduleOnFailureDelay = Duration.ZERO;
        private boolean persistent;

        private Builder(String tag, String type) {
            this.tag = tag;
            this.type = type;
        }

        public Builder userId(Long userId) {
            this.userId = userId;
            return this;
        }

        public Builder data(Object data) {
            this.data = data;
            return this;
        }

        public Builder due(OffsetDateTime due) {
            this.due = due;
            return this;
        }

        /**
         * Retention after {@code due} before a finished job may be garbage collected.
         * {@code null} or zero selects the configured default.
         */
        public Builder removeDelay(Duration removeDelay) {
            this.removeDelay = removeDelay;
            return this;
        }

        public Builder autoRescheduleOnFailure(Duration delay) {
            this.autoRescheduleOnFailure = true;
            this.autoRescheduleOnFailureDelay = Objects.requireNonNull(delay, "delay");
            return this;
        }

        public Builder persistent(boolean persistent) {
            this.persistent = persistent;
            return this;
        }

        public JobRequest build() {
            return new JobRequest(this);
        }
    }
}
