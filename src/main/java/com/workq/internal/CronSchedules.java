package com.workq.internal;

import org.springframework.scheduling.support.CronExpression;

import java.time.OffsetDateTime;
import java.util.Optional;

/**
 * Parsing and fire time computation for the six-field cron expressions stored on recurring jobs.
 */
public final class CronSchedules {

    private CronSchedules() {
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        try {
            return CronExpression.parse(expression.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    /**
     * Next fire time strictly after {@code after}, or empty if the expression never fires again.
     */
    public static Optional<OffsetDateTime> nextAfter(String expression, OffsetDateTime after) {
        return Optional.ofNullable(parse(expression).next(after));
    }

    /**
     * First fire time at or after {@code at}; {@code at} itself is returned when the expression matches it.
     */
    public static Optional<OffsetDateTime> nextOnOrAfter(String expression, OffsetDateTime at) {
        return nextAfter(expression, at.minusNanos(1));
    }

    /**
     * Next fire time of a recurring job: strictly after its previous due time and never in the past.
     */
    public static Optional<OffsetDateTime> nextOccurrence(String expression, OffsetDateTime previousDue,
            OffsetDateTime now) {
        OffsetDateTime after = previousDue != null && previousDue.isAfter(now) ? previousDue : now;
        return nextAfter(expression, after);
    }
}
