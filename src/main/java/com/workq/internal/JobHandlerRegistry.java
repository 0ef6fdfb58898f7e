package com.workq.internal;

import com.workq.JobHandler;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps job types to their handler beans. Built once at startup; lookups never change afterwards.
 */
public class JobHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobHandlerRegistry.class);

    private final List<JobHandler<?>> handlers;
    private Map<String, RegisteredHandler> handlerMap = Map.of();

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        this.handlers = handlers == null ? List.of() : handlers;
    }

    @PostConstruct
    public void init() {
        Map<String, RegisteredHandler> registrations = new LinkedHashMap<>();
        for (JobHandler<?> handler : handlers) {
            register(registrations, handler);
        }
        this.handlerMap = Map.copyOf(registrations);
        log.info("Job handler registry initialized with {} job type(s): {}", handlerMap.size(), handlerMap.keySet());
    }

    public Optional<RegisteredHandler> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlerMap.get(type));
    }

    public Collection<RegisteredHandler> all() {
        return handlerMap.values();
    }

    public boolean isEmpty() {
        return handlerMap.isEmpty();
    }

    private void register(Map<String, RegisteredHandler> registrations, JobHandler<?> handler) {
        Class<?> targetClass = ClassUtils.getUserClass(handler);
        String source = "JobHandler bean " + targetClass.getName();

        String jobType = handler.getJobType() == null ? "" : handler.getJobType().trim();
        if (jobType.isEmpty()) {
            throw new IllegalStateException("Job type must not be blank on " + source);
        }
        Class<?> payloadClass = handler.getPayloadClass();
        if (payloadClass == null) {
            throw new IllegalStateException("Payload class must not be null on " + source);
        }
        com.workq.annotation.Job annotation = AnnotationUtils.findAnnotation(targetClass,
                com.workq.annotation.Job.class);

        RegisteredHandler existing = registrations.putIfAbsent(jobType,
                new RegisteredHandler(jobType, handler, payloadClass, annotation));
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate job type '" + jobType + "' detected while registering " + source
                            + ". Each job type must be unique.");
        }
    }

    /**
     * A handler bound to its job type.
     *
     * @param annotation the {@code @Job} annotation of the handler class, or {@code null}
     */
    public record RegisteredHandler(
            String type,
            JobHandler<?> handler,
            Class<?> payloadClass,
            com.workq.annotation.Job annotation) {
    }
}
