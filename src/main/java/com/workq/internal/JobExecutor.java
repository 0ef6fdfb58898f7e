package com.workq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.Job;
import com.workq.JobContext;
import com.workq.JobHandler;
import com.workq.JobResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Dispatches a claimed job to its handler and turns whatever happens into a {@link JobOutcome}.
 * Never throws for handler failures; only a {@link VirtualMachineError} escapes.
 */
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    static final String MDC_JOB_ID = "jobId";
    static final String MDC_JOB_TYPE = "jobType";
    static final String MDC_JOB_TAG = "jobTag";

    private final JobHandlerRegistry registry;
    private final ObjectMapper objectMapper;

    public JobExecutor(JobHandlerRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    public JobOutcome execute(Job job) {
        try (MDC.MDCCloseable ignoredId = MDC.putCloseable(MDC_JOB_ID, String.valueOf(job.getId()));
                MDC.MDCCloseable ignoredType = MDC.putCloseable(MDC_JOB_TYPE, job.getType());
                MDC.MDCCloseable ignoredTag = MDC.putCloseable(MDC_JOB_TAG, job.getTag())) {
            JobHandlerRegistry.RegisteredHandler registration = registry.find(job.getType()).orElse(null);
            if (registration == null) {
                log.warn("No handler registered for job {} of type {}", job.getId(), job.getType());
                return JobOutcome.failed(JobResults.UNKNOWN_TYPE_PREFIX + job.getType());
            }
            return invoke(job, registration);
        }
    }

    private JobOutcome invoke(Job job, JobHandlerRegistry.RegisteredHandler registration) {
        try {
            Object payload = convertPayload(job.getData(), registration.payloadClass());
            @SuppressWarnings("unchecked")
            JobHandler<Object> handler = (JobHandler<Object>) registration.handler();
            Object output = handler.process(JobContext.of(job), payload);
            log.debug("Job {} of type {} succeeded", job.getId(), job.getType());
            return JobOutcome.succeeded(toResult(output));
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            // AssertionError, LinkageError and friends fail the job, not the worker
            log.error("Job {} of type {} failed", job.getId(), job.getType(), e);
            return JobOutcome.failed(errorMessage(e));
        }
    }

    private Object convertPayload(JsonNode data, Class<?> payloadClass) throws Exception {
        if (payloadClass == Void.class || data == null) {
            return null;
        }
        return objectMapper.treeToValue(data, payloadClass);
    }

    private JsonNode toResult(Object output) {
        if (output == null) {
            return null;
        }
        if (output instanceof JsonNode node) {
            return node;
        }
        return objectMapper.valueToTree(output);
    }

    static String errorMessage(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }
}
