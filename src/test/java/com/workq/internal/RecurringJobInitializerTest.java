package com.workq.internal;

import com.workq.Job;
import com.workq.JobContext;
import com.workq.JobHandler;
import com.workq.JobRequest;
import com.workq.JobScheduler;
import com.workq.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecurringJobInitializerTest {

    private JobScheduler jobScheduler;
    private JobStore jobStore;
    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        jobScheduler = mock(JobScheduler.class);
        jobStore = mock(JobStore.class);
        environment = new MockEnvironment();
        when(jobScheduler.scheduleCronJob(any(JobRequest.class), anyString())).thenAnswer(invocation -> {
            JobRequest request = invocation.getArgument(0);
            return new Job(request.getTag(), request.getType(), null, null, OffsetDateTime.now());
        });
    }

    @com.workq.annotation.Job(value = "digest", cron = "*/5 * * * * *")
    static class DigestHandler implements JobHandler<Void> {
        @Override
        public Object process(JobContext context, Void payload) {
            return null;
        }
    }

    @com.workq.annotation.Job(value = "sweep", cron = "${sweep.cron:0 0 * * * *}", tag = "maintenance",
            autoRescheduleOnFailure = true, autoRescheduleOnFailureDelay = "${sweep.retry:30s}", removeDelay = "2h",
            persistent = true)
    static class SweepHandler implements JobHandler<Void> {
        @Override
        public Object process(JobContext context, Void payload) {
            return null;
        }
    }

    @com.workq.annotation.Job("once")
    static class OneOffHandler implements JobHandler<Void> {
        @Override
        public Object process(JobContext context, Void payload) {
            return null;
        }
    }

    @com.workq.annotation.Job(value = "broken", cron = "not-a-cron")
    static class InvalidCronHandler implements JobHandler<Void> {
        @Override
        public Object process(JobContext context, Void payload) {
            return null;
        }
    }

    @Test
    void shouldBootstrapRecurringJobOnDefaultTag() {
        RecurringJobInitializer initializer = initializer(new DigestHandler(), new OneOffHandler());

        initializer.start();

        ArgumentCaptor<JobRequest> captor = ArgumentCaptor.forClass(JobRequest.class);
        verify(jobScheduler).scheduleCronJob(captor.capture(), eq("*/5 * * * * *"));
        JobRequest request = captor.getValue();
        assertEquals("cron:digest", request.getTag());
        assertEquals("digest", request.getType());
        assertTrue(initializer.isRunning());
    }

    @Test
    void shouldResolvePlaceholdersAndCopyAnnotationSettings() {
        environment.setProperty("sweep.cron", "0 30 2 * * *");

        List<RecurringJobInitializer.RecurringDefinition> definitions =
                initializer(new SweepHandler()).recurringDefinitions();

        assertThat(definitions).hasSize(1);
        RecurringJobInitializer.RecurringDefinition definition = definitions.get(0);
        assertEquals("0 30 2 * * *", definition.cron());
        assertEquals("maintenance", definition.tag());
        assertTrue(definition.request().isAutoRescheduleOnFailure());
        assertEquals(Duration.ofSeconds(30), definition.request().getAutoRescheduleOnFailureDelay());
        assertEquals(Duration.ofHours(2), definition.request().getRemoveDelay());
        assertTrue(definition.request().isPersistent());
    }

    @Test
    void shouldSkipRecurringJobThatIsAlreadyPending() {
        when(jobStore.hasPendingRecurrence("cron:digest", "digest", "*/5 * * * * *")).thenReturn(true);

        initializer(new DigestHandler()).start();

        verify(jobScheduler, never()).scheduleCronJob(any(JobRequest.class), anyString());
    }

    @Test
    void shouldFailStartupOnInvalidCronExpression() {
        RecurringJobInitializer initializer = initializer(new InvalidCronHandler());

        IllegalStateException error = assertThrows(IllegalStateException.class, initializer::start);
        assertThat(error.getMessage()).contains("not-a-cron").contains("broken");
        verify(jobScheduler, never()).scheduleCronJob(any(JobRequest.class), anyString());
    }

    @Test
    void shouldKeepStartingWhenStoreIsUnavailable() {
        when(jobStore.hasPendingRecurrence(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("connection refused"));

        RecurringJobInitializer initializer = initializer(new DigestHandler());
        initializer.start();

        assertTrue(initializer.isRunning());
    }

    private RecurringJobInitializer initializer(JobHandler<?>... handlers) {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(handlers));
        registry.init();
        return new RecurringJobInitializer(registry, jobScheduler, jobStore, environment);
    }
}
