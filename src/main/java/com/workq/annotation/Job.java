package com.workq.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the job type handled by a {@link com.workq.JobHandler} bean and, optionally, a recurring
 * schedule that is bootstrapped when the supervisor starts.
 * <p>
 * String attributes holding a cron expression or a duration may use {@code ${...}} placeholders;
 * durations accept Spring Boot's formats ({@code 500ms}, {@code 1m}, {@code PT1H}).
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The type of job this handler processes. Must be unique across all handlers.
     */
    String value();

    /**
     * Six-field cron expression ({@code second minute hour day-of-month month day-of-week}).
     * When set, a job of this type is kept scheduled on the tag {@link #tag()}.
     */
    String cron() default "";

    /**
     * Tag of the recurring job. Defaults to {@code cron:<type>}.
     */
    String tag() default "";

    /**
     * Whether a failed execution of the recurring job schedules a retry.
     */
    boolean autoRescheduleOnFailure() default false;

    /**
     * Delay before the retry of a failed recurring execution.
     */
    String autoRescheduleOnFailureDelay() default "0";

    /**
     * Retention of finished recurring executions. Blank means the configured default.
     */
    String removeDelay() default "";

    /**
     * Finished executions of persistent jobs are never garbage collected.
     */
    boolean persistent() default false;
}
