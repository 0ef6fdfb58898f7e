package com.workq;

import com.workq.config.WorkQProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.EncodedResource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.jdbc.datasource.init.ScriptUtils;
import org.springframework.util.StreamUtils;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies the versioned SQL scripts under {@code workq/migration} before anything touches the job table.
 * <p>
 * Scripts are named {@code V<version>__<description>.sql}, may reference {@code ${prefix}} to honour
 * {@code workq.database.table-prefix}, and are recorded with a SHA-256 checksum so an edited script that
 * was already applied fails startup. A PostgreSQL advisory lock serializes concurrent initializers.
 */
@ConditionalOnProperty(prefix = "workq.database", name = "skip-create", havingValue = "false", matchIfMissing = true)
public class JobSchemaInitializer implements InitializingBean {

    private static final Logger log = LoggerFactory.getLogger(JobSchemaInitializer.class);
    private static final Pattern SAFE_PREFIX = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SCRIPT_NAME = Pattern.compile("^V(\\d+)__([A-Za-z0-9_\\-]+)\\.sql$");
    private static final String SCRIPT_LOCATION = "classpath*:workq/migration/V*__*.sql";
    private static final String PREFIX_PLACEHOLDER = "${prefix}";
    private static final long ADVISORY_LOCK_KEY = 0x776f726b71L; // "workq"

    private final DataSource dataSource;
    private final PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final String tablePrefix;
    private final boolean failOnMigrationError;

    public JobSchemaInitializer(DataSource dataSource, ObjectProvider<WorkQProperties> propertiesProvider,
            Environment environment) {
        this.dataSource = dataSource;
        WorkQProperties properties = propertiesProvider.getIfAvailable();
        String prefix = properties != null
                ? properties.getDatabase().getTablePrefix()
                : environment.getProperty("workq.database.table-prefix", "");
        this.tablePrefix = validatePrefix(prefix);
        this.failOnMigrationError = properties != null
                ? properties.getDatabase().isFailOnMigrationError()
                : environment.getProperty("workq.database.fail-on-migration-error", Boolean.class, true);
    }

    @Override
    public void afterPropertiesSet() {
        String historyTable = tablePrefix + "workq_schema_history";
        try (Connection connection = dataSource.getConnection()) {
            lock(connection);
            try {
                int applied = migrate(connection, historyTable);
                log.info("WorkQ schema ready ({} migration(s) applied now, history in {})", applied, historyTable);
            } finally {
                unlock(connection);
            }
        } catch (Exception e) {
            if (failOnMigrationError) {
                throw new IllegalStateException("Failed to migrate the WorkQ database schema", e);
            }
            log.error("Failed to migrate the WorkQ database schema; continuing because "
                    + "workq.database.fail-on-migration-error=false", e);
        }
    }

    private int migrate(Connection connection, String historyTable) throws SQLException, IOException {
        try (Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        version INTEGER PRIMARY KEY,
                        script VARCHAR(255) NOT NULL,
                        checksum CHAR(64) NOT NULL,
                        applied_at TIMESTAMPTZ NOT NULL DEFAULT now()
                    )
                    """.formatted(historyTable));
        }

        List<Script> scripts = loadScripts();
        if (scripts.isEmpty()) {
            throw new IllegalStateException("No WorkQ migration scripts found at " + SCRIPT_LOCATION);
        }
        Map<Integer, String> history = loadHistory(connection, historyTable);

        int applied = 0;
        for (Script script : scripts) {
            String recordedChecksum = history.remove(script.version());
            if (recordedChecksum != null) {
                if (!recordedChecksum.equals(script.checksum())) {
                    throw new IllegalStateException("Migration " + script.name()
                            + " was modified after it had been applied");
                }
                continue;
            }
            apply(connection, historyTable, script);
            applied++;
        }
        if (!history.isEmpty()) {
            throw new IllegalStateException("Applied migration version(s) " + history.keySet()
                    + " are missing from the classpath");
        }
        return applied;
    }

    private List<Script> loadScripts() throws IOException {
        List<Script> scripts = new ArrayList<>();
        for (Resource resource : resolver.getResources(SCRIPT_LOCATION)) {
            String name = resource.getFilename();
            if (name == null) {
                continue;
            }
            Matcher matcher = SCRIPT_NAME.matcher(name);
            if (!matcher.matches()) {
                throw new IllegalStateException("Invalid WorkQ migration name '" + name
                        + "'; expected V<version>__<description>.sql");
            }
            String sql = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);
            scripts.add(new Script(Integer.parseInt(matcher.group(1)), name, sql, sha256(sql)));
        }
        scripts.sort(Comparator.comparingInt(Script::version));
        for (int i = 1; i < scripts.size(); i++) {
            if (scripts.get(i).version() == scripts.get(i - 1).version()) {
                throw new IllegalStateException("Duplicate WorkQ migration version in "
                        + scripts.get(i - 1).name() + " and " + scripts.get(i).name());
            }
        }
        return scripts;
    }

    private Map<Integer, String> loadHistory(Connection connection, String historyTable) throws SQLException {
        Map<Integer, String> history = new LinkedHashMap<>();
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT version, checksum FROM " + historyTable + " ORDER BY version");
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                history.put(rs.getInt("version"), rs.getString("checksum").trim());
            }
        }
        return history;
    }

    private void apply(Connection connection, String historyTable, Script script) throws SQLException {
        boolean autoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            String rendered = script.sql().replace(PREFIX_PLACEHOLDER, tablePrefix);
            ScriptUtils.executeSqlScript(connection, new EncodedResource(
                    new ByteArrayResource(rendered.getBytes(StandardCharsets.UTF_8), script.name()),
                    StandardCharsets.UTF_8));
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO " + historyTable + " (version, script, checksum) VALUES (?, ?, ?)")) {
                statement.setInt(1, script.version());
                statement.setString(2, script.name());
                statement.setString(3, script.checksum());
                statement.executeUpdate();
            }
            connection.commit();
            log.info("Applied WorkQ migration {}", script.name());
        } catch (RuntimeException | SQLException e) {
            connection.rollback();
            throw new IllegalStateException("Failed to apply WorkQ migration " + script.name(), e);
        } finally {
            connection.setAutoCommit(autoCommit);
        }
    }

    private void lock(Connection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_lock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        }
    }

    private void unlock(Connection connection) {
        try (PreparedStatement statement = connection.prepareStatement("SELECT pg_advisory_unlock(?)")) {
            statement.setLong(1, ADVISORY_LOCK_KEY);
            statement.execute();
        } catch (SQLException e) {
            log.warn("Failed to release the WorkQ migration lock", e);
        }
    }

    private static String validatePrefix(String prefix) {
        String trimmed = prefix == null ? "" : prefix.trim();
        if (!trimmed.isEmpty() && !SAFE_PREFIX.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported workq.database.table-prefix: " + trimmed);
        }
        return trimmed;
    }

    private static String sha256(String content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private record Script(int version, String name, String sql, String checksum) {
    }
}
