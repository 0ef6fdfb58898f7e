package com.workq.process;

import com.workq.config.WorkQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Forks worker processes as new JVMs running the application's main class in the worker role:
 * {@code java -cp <classpath> <mainClass> --workq.role=worker --workq.worker-id=<n>}.
 * <p>
 * Configured properties are forwarded through the child's environment rather than its command line,
 * so credentials do not show up in process listings.
 */
public class JvmWorkerProcessLauncher implements WorkerProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(JvmWorkerProcessLauncher.class);

    private final WorkQProperties.Workers settings;
    private final Environment environment;
    private final Supplier<String> mainClassResolver;
    private volatile String mainClass;

    /**
     * @param mainClassResolver used when {@code workq.workers.main-class} is not set
     */
    public JvmWorkerProcessLauncher(WorkQProperties.Workers settings, Environment environment,
            Supplier<String> mainClassResolver) {
        this.settings = settings;
        this.environment = environment;
        this.mainClassResolver = mainClassResolver;
    }

    @Override
    public WorkerHandle launch(int ordinal) {
        ProcessBuilder builder = new ProcessBuilder(buildCommand(ordinal)).redirectErrorStream(true);
        forwardProperties(builder.environment());
        try {
            Process process = builder.start();
            log.debug("Launched worker {} with pid {}", ordinal, process.pid());
            return new ChildProcessWorkerHandle(ordinal, process);
        } catch (IOException e) {
            throw new WorkerStartupException("Unable to launch worker " + ordinal, e);
        }
    }

    List<String> buildCommand(int ordinal) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable());
        command.addAll(settings.getJvmArgs());
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(resolveMainClass());
        command.add("--workq.role=worker");
        command.add("--workq.worker-id=" + ordinal);
        return command;
    }

    void forwardProperties(Map<String, String> childEnvironment) {
        for (String property : settings.getForwardedProperties()) {
            String value = environment.getProperty(property);
            if (value != null) {
                childEnvironment.put(toEnvironmentVariable(property), value);
            }
        }
    }

    /**
     * Maps a property name to the environment variable Spring Boot binds it from:
     * dots become underscores, dashes are dropped, everything is upper case.
     */
    static String toEnvironmentVariable(String property) {
        return property.replace('.', '_').replace("-", "").toUpperCase(Locale.ROOT);
    }

    String resolveMainClass() {
        String resolved = mainClass;
        if (resolved != null) {
            return resolved;
        }
        String configured = settings.getMainClass();
        resolved = configured != null && !configured.isBlank() ? configured.trim() : mainClassResolver.get();
        if (resolved == null || resolved.isBlank()) {
            throw new IllegalStateException(
                    "Unable to determine the worker main class. Set workq.workers.main-class.");
        }
        this.mainClass = resolved;
        return resolved;
    }

    private static String javaExecutable() {
        return Path.of(System.getProperty("java.home"), "bin", "java").toString();
    }
}
