package com.workq;

import com.workq.internal.WorkQMetrics;
import com.workq.process.WorkerSupervisor;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(after = WorkQAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
public class WorkQMetricsAutoConfiguration {

    @Bean
    @ConditionalOnBean(MeterRegistry.class)
    public WorkQMetrics workqMetrics(JobRepository jobRepository, MeterRegistry meterRegistry,
            ObjectProvider<WorkerSupervisor> workerSupervisor) {
        return new WorkQMetrics(jobRepository, meterRegistry, workerSupervisor.getIfAvailable());
    }
}
