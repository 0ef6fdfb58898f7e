package com.workq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.workq.config.WorkQProperties;
import com.workq.internal.JobExecutionLoop;
import com.workq.internal.JobExecutor;
import com.workq.internal.JobHandlerRegistry;
import com.workq.internal.RecurringJobInitializer;
import com.workq.internal.RemoveOldJobsHandler;
import com.workq.internal.ReschedulePolicy;
import com.workq.internal.Sleeper;
import com.workq.internal.StaleJobReaper;
import com.workq.process.JvmWorkerProcessLauncher;
import com.workq.process.LiveWorkerRegistry;
import com.workq.process.WorkerProcessAgent;
import com.workq.process.WorkerProcessLauncher;
import com.workq.process.WorkerRegistry;
import com.workq.process.WorkerSupervisor;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.jpa.JpaRepositoriesAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.env.Environment;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.ClassUtils;

import java.time.Clock;
import java.util.Locale;

/**
 * Wires the job store and scheduler in every process, the worker pool in the supervisor process
 * ({@code workq.role=supervisor}, the default) and the execution loop in worker processes
 * ({@code workq.role=worker}).
 */
@AutoConfiguration(before = { HibernateJpaAutoConfiguration.class, JpaRepositoriesAutoConfiguration.class })
@AutoConfigurationPackage(basePackages = "com.workq")
@EnableScheduling
@EnableConfigurationProperties(WorkQProperties.class)
public class WorkQAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "workqClock")
    public Clock workqClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(name = "workqObjectMapper")
    public ObjectMapper workqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(name = "workqHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer workqHibernatePropertiesCustomizer(WorkQProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // Only WorkQ tables
                                if (original.getText().toLowerCase(Locale.ROOT).startsWith("workq_")) {
                                    return new Identifier(prefix.trim() + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStore jobStore(JobRepository jobRepository, JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate, WorkQProperties properties,
            @Qualifier("workqClock") Clock clock) {
        return new JobStore(jobRepository, jdbcTemplate, transactionTemplate, properties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobStore jobStore, @Qualifier("workqObjectMapper") ObjectMapper objectMapper,
            TransactionTemplate transactionTemplate, WorkQProperties properties,
            @Qualifier("workqClock") Clock clock) {
        return new JobScheduler(jobStore, objectMapper, transactionTemplate, properties, clock);
    }

    @Bean
    public JobHandlerRegistry jobHandlerRegistry(ObjectProvider<JobHandler<?>> handlers) {
        return new JobHandlerRegistry(handlers.orderedStream().toList());
    }

    @Bean
    public JobExecutor jobExecutor(JobHandlerRegistry jobHandlerRegistry,
            @Qualifier("workqObjectMapper") ObjectMapper objectMapper) {
        return new JobExecutor(jobHandlerRegistry, objectMapper);
    }

    @Bean
    public ReschedulePolicy reschedulePolicy(JobScheduler jobScheduler, JobStore jobStore,
            @Qualifier("workqClock") Clock clock) {
        return new ReschedulePolicy(jobScheduler, jobStore, clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "workq.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RemoveOldJobsHandler removeOldJobsHandler(JobStore jobStore) {
        return new RemoveOldJobsHandler(jobStore);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "workq", name = "role", havingValue = "supervisor", matchIfMissing = true)
    @Import(JobSchemaInitializer.class)
    static class SupervisorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkerRegistry workerRegistry() {
            return new LiveWorkerRegistry();
        }

        @Bean
        @ConditionalOnMissingBean
        public WorkerProcessLauncher workerProcessLauncher(WorkQProperties properties, Environment environment,
                ApplicationContext applicationContext) {
            return new JvmWorkerProcessLauncher(properties.getWorkers(), environment,
                    () -> applicationContext.getBeansWithAnnotation(SpringBootApplication.class).values().stream()
                            .findFirst()
                            .map(bean -> ClassUtils.getUserClass(bean).getName())
                            .orElse(null));
        }

        @Bean
        public WorkerSupervisor workerSupervisor(WorkerProcessLauncher workerProcessLauncher,
                WorkerRegistry workerRegistry, WorkQProperties properties) {
            return new WorkerSupervisor(workerProcessLauncher, workerRegistry, properties.getWorkers());
        }

        @Bean
        public RecurringJobInitializer recurringJobInitializer(JobHandlerRegistry jobHandlerRegistry,
                JobScheduler jobScheduler, JobStore jobStore, Environment environment) {
            return new RecurringJobInitializer(jobHandlerRegistry, jobScheduler, jobStore, environment);
        }

        @Bean
        public StaleJobReaper staleJobReaper(JobStore jobStore, ReschedulePolicy reschedulePolicy,
                WorkQProperties properties, @Qualifier("workqClock") Clock clock) {
            return new StaleJobReaper(jobStore, reschedulePolicy, properties, clock);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "workq", name = "role", havingValue = "worker")
    static class WorkerConfiguration {

        @Bean
        public JobExecutionLoop jobExecutionLoop(JobStore jobStore, JobExecutor jobExecutor,
                ReschedulePolicy reschedulePolicy, WorkQProperties properties) {
            return new JobExecutionLoop(jobStore, jobExecutor, reschedulePolicy, Sleeper.THREAD,
                    properties.getWorker().getPollInterval());
        }

        @Bean
        public WorkerProcessAgent workerProcessAgent(JobExecutionLoop jobExecutionLoop, WorkQProperties properties) {
            return new WorkerProcessAgent(jobExecutionLoop, properties.getWorkerId(),
                    properties.getWorker().getStopTimeout(), System.out, System::exit);
        }
    }
}
