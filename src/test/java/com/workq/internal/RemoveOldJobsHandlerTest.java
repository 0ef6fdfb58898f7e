package com.workq.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workq.JobContext;
import com.workq.JobStore;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RemoveOldJobsHandlerTest {

    private final JobStore jobStore = mock(JobStore.class);
    private final RemoveOldJobsHandler handler = new RemoveOldJobsHandler(jobStore);
    private final JobContext context = new JobContext(77L, "cron:removeOldWorkerJobs",
            RemoveOldJobsHandler.JOB_TYPE, null, OffsetDateTime.now(), null);

    @Test
    @SuppressWarnings("unchecked")
    void shouldAlwaysExcludeItsOwnJob() {
        when(jobStore.deleteRemovable(anyCollection(), anyCollection())).thenReturn(4);

        Object result = handler.process(context, null);

        ArgumentCaptor<Collection<Long>> ids = ArgumentCaptor.forClass(Collection.class);
        ArgumentCaptor<Collection<String>> tags = ArgumentCaptor.forClass(Collection.class);
        verify(jobStore).deleteRemovable(ids.capture(), tags.capture());
        assertThat(ids.getValue()).containsExactly(77L);
        assertThat(tags.getValue()).isEmpty();
        assertEquals(Map.of("deleted", 4), result);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldHonourExclusionsFromPayload() throws Exception {
        RemoveOldJobsPayload payload = new ObjectMapper().readValue(
                "{\"excludeIds\":[1,2],\"excludeTags\":[\"audit\"]}", RemoveOldJobsPayload.class);

        handler.process(context, payload);

        ArgumentCaptor<Collection<Long>> ids = ArgumentCaptor.forClass(Collection.class);
        ArgumentCaptor<Collection<String>> tags = ArgumentCaptor.forClass(Collection.class);
        verify(jobStore).deleteRemovable(ids.capture(), tags.capture());
        assertThat(ids.getValue()).containsExactly(1L, 2L, 77L);
        assertThat(tags.getValue()).containsExactly("audit");
    }

    @Test
    void shouldTreatMissingPayloadListsAsEmpty() {
        RemoveOldJobsPayload payload = new RemoveOldJobsPayload(null, null);

        assertThat(payload.excludeIds()).isEmpty();
        assertThat(payload.excludeTags()).isEqualTo(List.of());
    }

    @Test
    void shouldBeRegisteredAsRecurringJobWithRetry() {
        com.workq.annotation.Job annotation = RemoveOldJobsHandler.class.getAnnotation(com.workq.annotation.Job.class);

        assertEquals(RemoveOldJobsHandler.JOB_TYPE, handler.getJobType());
        assertEquals(RemoveOldJobsPayload.class, handler.getPayloadClass());
        assertThat(annotation.cron()).isNotBlank();
        assertThat(annotation.autoRescheduleOnFailure()).isTrue();
    }
}
