package com.workq.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.workq.Job;
import com.workq.JobContext;
import com.workq.JobHandler;
import com.workq.JobResults;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobExecutorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldFailJobWithUnknownType() {
        JobExecutor executor = executor(List.of());

        JobOutcome outcome = executor.execute(job("missing", Map.of()));

        assertFalse(outcome.success());
        assertEquals("Unknown job type: missing", JobResults.errorOf(outcome.result()));
    }

    @Test
    void shouldConvertPayloadAndStoreReturnedValue() {
        AtomicReference<GreetingPayload> received = new AtomicReference<>();
        AtomicReference<JobContext> context = new AtomicReference<>();
        JobExecutor executor = executor(List.of(new GreetingHandler(received, context)));

        Job job = job("greet", Map.of("name", "Ada", "times", 2));
        JobOutcome outcome = executor.execute(job);

        assertTrue(outcome.success());
        assertEquals(new GreetingPayload("Ada", 2), received.get());
        assertEquals("Hello Ada Hello Ada", outcome.result().get("greeting").asText());
        assertEquals(5L, context.get().jobId());
        assertEquals("greetings", context.get().tag());
    }

    @Test
    void shouldStoreNullResultWhenHandlerReturnsNothing() {
        JobHandler<JsonNode> handler = new FixedTypeHandler("noop", (ctx, payload) -> null);

        JobOutcome outcome = executor(List.of(handler)).execute(job("noop", Map.of()));

        assertTrue(outcome.success());
        assertNull(outcome.result());
    }

    @Test
    void shouldKeepJsonNodeResultAsIs() {
        JsonNode document = JsonNodeFactory.instance.objectNode().put("rows", 3);
        JobHandler<JsonNode> handler = new FixedTypeHandler("import", (ctx, payload) -> document);

        JobOutcome outcome = executor(List.of(handler)).execute(job("import", Map.of()));

        assertThat(outcome.result()).isSameAs(document);
    }

    @Test
    void shouldRecordExceptionMessageAsError() {
        JobHandler<JsonNode> handler = new FixedTypeHandler("boom", (ctx, payload) -> {
            throw new IllegalStateException("remote service unavailable");
        });

        JobOutcome outcome = executor(List.of(handler)).execute(job("boom", Map.of()));

        assertFalse(outcome.success());
        assertEquals("remote service unavailable", JobResults.errorOf(outcome.result()));
    }

    @Test
    void shouldFallBackToExceptionClassNameWithoutMessage() {
        JobHandler<JsonNode> handler = new FixedTypeHandler("npe", (ctx, payload) -> {
            throw new NullPointerException();
        });

        JobOutcome outcome = executor(List.of(handler)).execute(job("npe", Map.of()));

        assertEquals(NullPointerException.class.getName(), JobResults.errorOf(outcome.result()));
    }

    @Test
    void shouldRecordErrorsThrownByHandlerAsFailedOutcome() {
        JobHandler<JsonNode> asserting = new FixedTypeHandler("asserting", (ctx, payload) -> {
            throw new AssertionError("invariant broken");
        });
        JobHandler<JsonNode> unlinked = new FixedTypeHandler("unlinked", (ctx, payload) -> {
            throw new NoClassDefFoundError("com/example/Missing");
        });
        JobExecutor executor = executor(List.of(asserting, unlinked));

        JobOutcome assertionOutcome = executor.execute(job("asserting", Map.of()));
        JobOutcome linkageOutcome = executor.execute(job("unlinked", Map.of()));

        assertFalse(assertionOutcome.success());
        assertEquals("invariant broken", JobResults.errorOf(assertionOutcome.result()));
        assertFalse(linkageOutcome.success());
        assertEquals("com/example/Missing", JobResults.errorOf(linkageOutcome.result()));
    }

    @Test
    void shouldLetVirtualMachineErrorsThrough() {
        JobHandler<JsonNode> handler = new FixedTypeHandler("oom", (ctx, payload) -> {
            throw new OutOfMemoryError("Java heap space");
        });
        JobExecutor executor = executor(List.of(handler));

        assertThrows(OutOfMemoryError.class, () -> executor.execute(job("oom", Map.of())));
        assertNull(MDC.get("jobId"));
    }

    @Test
    void shouldFailWhenPayloadCannotBeConverted() {
        JobExecutor executor = executor(List.of(new GreetingHandler(new AtomicReference<>(), new AtomicReference<>())));

        JobOutcome outcome = executor.execute(job("greet", Map.of("times", "many")));

        assertFalse(outcome.success());
        assertThat(JobResults.errorOf(outcome.result())).isNotBlank();
    }

    @Test
    void shouldExposeJobIdentityInMdcWhileRunning() {
        AtomicReference<String> mdcJobId = new AtomicReference<>();
        AtomicReference<String> mdcTag = new AtomicReference<>();
        JobHandler<JsonNode> handler = new FixedTypeHandler("mdc", (ctx, payload) -> {
            mdcJobId.set(MDC.get("jobId"));
            mdcTag.set(MDC.get("jobTag"));
            return null;
        });

        executor(List.of(handler)).execute(job("mdc", Map.of()));

        assertEquals("5", mdcJobId.get());
        assertEquals("greetings", mdcTag.get());
        assertNull(MDC.get("jobId"));
    }

    private JobExecutor executor(List<JobHandler<?>> handlers) {
        JobHandlerRegistry registry = new JobHandlerRegistry(handlers);
        registry.init();
        return new JobExecutor(registry, objectMapper);
    }

    private Job job(String type, Map<String, Object> data) {
        Job job = new Job("greetings", type, null, objectMapper.valueToTree(data), OffsetDateTime.now());
        job.setId(5L);
        return job;
    }

    record GreetingPayload(String name, int times) {
    }

    @com.workq.annotation.Job("greet")
    static class GreetingHandler implements JobHandler<GreetingPayload> {
        private final AtomicReference<GreetingPayload> received;
        private final AtomicReference<JobContext> context;

        GreetingHandler(AtomicReference<GreetingPayload> received, AtomicReference<JobContext> context) {
            this.received = received;
            this.context = context;
        }

        @Override
        public Object process(JobContext context, GreetingPayload payload) {
            this.received.set(payload);
            this.context.set(context);
            return Map.of("greeting", ("Hello " + payload.name() + " ").repeat(payload.times()).trim());
        }
    }

    interface Body {
        Object apply(JobContext context, JsonNode payload) throws Exception;
    }

    static class FixedTypeHandler implements JobHandler<JsonNode> {
        private final String type;
        private final Body body;

        FixedTypeHandler(String type, Body body) {
            this.type = type;
            this.body = body;
        }

        @Override
        public String getJobType() {
            return type;
        }

        @Override
        public Class<JsonNode> getPayloadClass() {
            return JsonNode.class;
        }

        @Override
        public Object process(JobContext context, JsonNode payload) throws Exception {
            return body.apply(context, payload);
        }
    }
}
