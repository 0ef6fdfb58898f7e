package com.workq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "workq")
public class WorkQProperties {

    private Role role = Role.SUPERVISOR;
    private int workerId = 0;

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();
    private final Workers workers = new Workers();
    private final Cleanup cleanup = new Cleanup();

    public Role getRole() {
        return role;
    }

    public void setRole(Role role) {
        this.role = role;
    }

    public int getWorkerId() {
        return workerId;
    }

    public void setWorkerId(int workerId) {
        this.workerId = workerId;
    }

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Worker getWorker() {
        return worker;
    }

    public Workers getWorkers() {
        return workers;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    /**
     * The parent process supervises the pool; each child runs exactly one execution loop.
     */
    public enum Role {
        SUPERVISOR,
        WORKER
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private Duration defaultRemoveDelay = Duration.ofHours(1);
        private Duration staleClaimTimeout = Duration.ofMinutes(30);
        private int staleCheckIntervalInSeconds = 60;

        public Duration getDefaultRemoveDelay() {
            return defaultRemoveDelay;
        }

        public void setDefaultRemoveDelay(Duration defaultRemoveDelay) {
            this.defaultRemoveDelay = defaultRemoveDelay;
        }

        public Duration getStaleClaimTimeout() {
            return staleClaimTimeout;
        }

        public void setStaleClaimTimeout(Duration staleClaimTimeout) {
            this.staleClaimTimeout = staleClaimTimeout;
        }

        public int getStaleCheckIntervalInSeconds() {
            return staleCheckIntervalInSeconds;
        }

        public void setStaleCheckIntervalInSeconds(int staleCheckIntervalInSeconds) {
            this.staleCheckIntervalInSeconds = staleCheckIntervalInSeconds;
        }
    }

    /**
     * Settings of the execution loop inside a worker process.
     */
    public static class Worker {
        private Duration pollInterval = Duration.ofSeconds(1);
        private Duration stopTimeout = Duration.ofSeconds(5);

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }

    /**
     * Settings of the worker process pool owned by the supervisor.
     */
    public static class Workers {
        static final String ALL_CPUS = "cpus";

        private String count = "1";
        private Duration startupTimeout = Duration.ofSeconds(10);
        private Duration shutdownTimeout = Duration.ofSeconds(5);
        private Duration restartBackoffInitial = Duration.ofSeconds(1);
        private Duration restartBackoffMax = Duration.ofSeconds(30);
        private String mainClass;
        private List<String> jvmArgs = new ArrayList<>();
        private List<String> forwardedProperties = new ArrayList<>(List.of(
                "spring.profiles.active",
                "spring.datasource.url",
                "spring.datasource.username",
                "spring.datasource.password",
                "workq.database.table-prefix",
                "workq.worker.poll-interval",
                "workq.worker.stop-timeout"));

        public String getCount() {
            return count;
        }

        public void setCount(String count) {
            this.count = count;
        }

        /**
         * Resolves {@link #getCount()} to a number of processes; {@code cpus} means one per available processor.
         */
        public int resolveCount() {
            String value = count == null ? "" : count.trim().toLowerCase(Locale.ROOT);
            if (value.isEmpty()) {
                throw new IllegalArgumentException("workq.workers.count must not be blank");
            }
            if (ALL_CPUS.equals(value)) {
                return Runtime.getRuntime().availableProcessors();
            }
            int resolved;
            try {
                resolved = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "workq.workers.count must be a non-negative integer or '" + ALL_CPUS + "' but was '" + count + "'", e);
            }
            if (resolved < 0) {
                throw new IllegalArgumentException("workq.workers.count must be >= 0 but was " + resolved);
            }
            return resolved;
        }

        public Duration getStartupTimeout() {
            return startupTimeout;
        }

        public void setStartupTimeout(Duration startupTimeout) {
            this.startupTimeout = startupTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getRestartBackoffInitial() {
            return restartBackoffInitial;
        }

        public void setRestartBackoffInitial(Duration restartBackoffInitial) {
            this.restartBackoffInitial = restartBackoffInitial;
        }

        public Duration getRestartBackoffMax() {
            return restartBackoffMax;
        }

        public void setRestartBackoffMax(Duration restartBackoffMax) {
            this.restartBackoffMax = restartBackoffMax;
        }

        public String getMainClass() {
            return mainClass;
        }

        public void setMainClass(String mainClass) {
            this.mainClass = mainClass;
        }

        public List<String> getJvmArgs() {
            return jvmArgs;
        }

        public void setJvmArgs(List<String> jvmArgs) {
            this.jvmArgs = jvmArgs;
        }

        public List<String> getForwardedProperties() {
            return forwardedProperties;
        }

        public void setForwardedProperties(List<String> forwardedProperties) {
            this.forwardedProperties = forwardedProperties;
        }
    }

    public static class Cleanup {
        private boolean enabled = true;
        private String cron = "0 * * * * *";
        private Duration retryDelay = Duration.ofMinutes(1);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public Duration getRetryDelay() {
            return retryDelay;
        }

        public void setRetryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
        }
    }
}
