package com.workq;

import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes jobs of a single type.
 * Implementations must be registered as Spring beans to be picked up by the
 * {@link com.workq.internal.JobHandlerRegistry}.
 *
 * @param <T> the type the stored {@code data} is converted to before processing
 */
public interface JobHandler<T> {

    Map<Class<?>, Class<?>> PAYLOAD_CLASS_CACHE = new ConcurrentHashMap<>();

    /**
     * Returns the globally unique type of job this handler processes.
     * By default, this is extracted from the {@link com.workq.annotation.Job} annotation.
     */
    default String getJobType() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        com.workq.annotation.Job annotation = AnnotationUtils.findAnnotation(targetClass,
                com.workq.annotation.Job.class);
        if (annotation == null || annotation.value().isBlank()) {
            throw new IllegalStateException("JobHandler " + targetClass.getName()
                    + " must either be annotated with @Job or override getJobType()");
        }
        return annotation.value();
    }

    /**
     * Processes a single job.
     * The returned value is stored as the job result. Any exception thrown from this method
     * marks the job as failed with the exception message as error.
     *
     * @param context identity of the job being processed
     * @param payload the converted job data
     * @return the result to store, or {@code null}
     * @throws Exception if processing fails
     */
    Object process(JobContext context, T payload) throws Exception;

    /**
     * Optionally returns the payload class the job data is converted to. By default, this is
     * inferred from {@code JobHandler<T>}.
     */
    @SuppressWarnings("unchecked")
    default Class<T> getPayloadClass() {
        Class<?> targetClass = ClassUtils.getUserClass(this);
        Class<?> payloadClass = PAYLOAD_CLASS_CACHE.computeIfAbsent(targetClass, JobHandler::inferPayloadClass);
        return (Class<T>) payloadClass;
    }

    private static Class<?> inferPayloadClass(Class<?> targetClass) {
        Class<?> resolved = ResolvableType.forClass(targetClass)
                .as(JobHandler.class)
                .getGeneric(0)
                .resolve();
        if (resolved == null) {
            throw new IllegalStateException("JobHandler " + targetClass.getName()
                    + " payload type cannot be inferred. Specify a concrete generic type or override getPayloadClass().");
        }
        return resolved;
    }
}
