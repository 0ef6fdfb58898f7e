package com.workq.config;

import com.workq.JobSchemaInitializer;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class JobSchemaInitializerConditionalTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withPropertyValues("workq.database.fail-on-migration-error=false")
            .withUserConfiguration(JobSchemaInitializer.class)
            .withBean(DataSource.class, () -> mock(DataSource.class));

    @Test
    void shouldCreateSchemaInitializerByDefault() {
        contextRunner.run(context -> assertFalse(context.getBeansOfType(JobSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldSkipSchemaInitializerWhenConfigured() {
        contextRunner.withPropertyValues("workq.database.skip-create=true")
                .run(context -> assertTrue(context.getBeansOfType(JobSchemaInitializer.class).isEmpty()));
    }

    @Test
    void shouldFailStartupOnMigrationErrorByDefault() {
        contextRunner.withPropertyValues("workq.database.fail-on-migration-error=true")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldRejectUnsafeTablePrefix() {
        contextRunner.withPropertyValues("workq.database.table-prefix=app; DROP TABLE x")
                .run(context -> assertThat(context).hasFailed());
    }
}
