package com.workq;

import com.fasterxml.jackson.databind.JsonNode;
import com.workq.config.WorkQProperties;
import com.workq.process.LiveWorkerRegistry;
import com.workq.process.WorkerProcessLauncher;
import com.workq.process.WorkerSupervisor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.autoconfigure.EnableAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Runs real worker processes (this class's {@link PoolWorkerApplication} in the worker role) against the
 * test database.
 */
@SpringBootTest(classes = WorkerPoolIntegrationTest.PoolWorkerApplication.class, properties = {
        "workq.workers.main-class=com.workq.WorkerPoolIntegrationTest$PoolWorkerApplication",
        "workq.workers.forwarded-properties=spring.datasource.url,spring.datasource.username,"
                + "spring.datasource.password,workq.worker.poll-interval",
        "workq.worker.poll-interval=200ms",
        "workq.jobs.stale-claim-timeout=5s",
        "workq.jobs.stale-check-interval-in-seconds=1"
})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@DisabledOnOs(OS.WINDOWS)
public class WorkerPoolIntegrationTest {

    static final String JOB_TYPE = "record-pid";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    @Autowired
    JobScheduler jobScheduler;

    @Autowired
    WorkerSupervisor contextSupervisor;

    @Autowired
    WorkerProcessLauncher workerProcessLauncher;

    private WorkerSupervisor pool;

    @SpringBootConfiguration
    @EnableAutoConfiguration
    public static class PoolWorkerApplication {

        public static void main(String[] args) {
            SpringApplication.run(PoolWorkerApplication.class, args);
        }

        @Bean
        RecordPidHandler recordPidHandler() {
            return new RecordPidHandler();
        }
    }

    @com.workq.annotation.Job(JOB_TYPE)
    public static class RecordPidHandler implements JobHandler<JsonNode> {
        @Override
        public Object process(JobContext context, JsonNode payload) throws InterruptedException {
            Thread.sleep(50);
            return Map.of("pid", ProcessHandle.current().pid());
        }
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop();
        }
    }

    @Test
    void shouldProcessJobsOnlyWhileWorkersRunAndSurviveAKilledWorker() {
        List<String> tags = scheduleJobs("before", 5);

        // Supervisor of the application context runs with zero workers
        assertThat(contextSupervisor.livePids()).isEmpty();
        await().during(Duration.ofSeconds(2)).atMost(Duration.ofSeconds(5))
                .until(() -> jobScheduler.getTotalPendingJobs() == tags.size());

        pool = new WorkerSupervisor(workerProcessLauncher, new LiveWorkerRegistry(), poolSettings());
        pool.start();
        assertEquals(2, pool.livePids().size());
        await().atMost(Duration.ofSeconds(60)).until(() -> allSucceeded(tags));

        long killedPid = pool.livePids().iterator().next();
        ProcessHandle.of(killedPid).ifPresent(ProcessHandle::destroyForcibly);
        List<String> afterKill = scheduleJobs("after", 20);

        await().atMost(Duration.ofSeconds(90)).until(() -> {
            Set<Long> live = pool.livePids();
            return live.size() == 2 && !live.contains(killedPid);
        });
        await().atMost(Duration.ofSeconds(90)).until(() -> allSucceeded(afterKill));
        assertEquals(1, pool.health().unexpectedExits());

        Job sample = jobScheduler.getJobsByTag(afterKill.get(0)).stream()
                .filter(job -> job.getStatus() == JobStatus.SUCCEEDED)
                .findFirst()
                .orElseThrow();
        assertThat(sample.getResult().get("pid").asLong()).isNotEqualTo(ProcessHandle.current().pid());
    }

    private List<String> scheduleJobs(String prefix, int count) {
        List<String> tags = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String tag = "pool:" + prefix + ":" + i;
            // A job lost with a killed worker is reaped and retried
            jobScheduler.scheduleJob(JobRequest.builder(tag, JOB_TYPE)
                    .autoRescheduleOnFailure(Duration.ZERO)
                    .build());
            tags.add(tag);
        }
        return tags;
    }

    private boolean allSucceeded(List<String> tags) {
        return tags.stream().allMatch(tag -> jobScheduler.getJobsByTag(tag).stream()
                .anyMatch(job -> job.getStatus() == JobStatus.SUCCEEDED));
    }

    private WorkQProperties.Workers poolSettings() {
        WorkQProperties.Workers settings = new WorkQProperties.Workers();
        settings.setCount("2");
        settings.setStartupTimeout(Duration.ofSeconds(60));
        settings.setShutdownTimeout(Duration.ofSeconds(10));
        settings.setRestartBackoffInitial(Duration.ofMillis(200));
        settings.setRestartBackoffMax(Duration.ofSeconds(2));
        return settings;
    }
}
