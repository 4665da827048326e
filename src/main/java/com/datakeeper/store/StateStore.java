package com.datakeeper.store;

import com.datakeeper.exception.PersistenceException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Embedded relational store for policy and job rows.
 * <p>
 * Every call borrows its own connection; no transaction spans two calls, so concurrent
 * writers on the same row are last-write-wins.
 */
public class StateStore {

    private static final Logger log = LoggerFactory.getLogger(StateStore.class);

    public static final String DEFAULT_SCHEMA = "db/schema.sql";

    /** Job columns that {@link #updateJob(String, Map)} may set. */
    static final Set<String> MUTABLE_JOB_COLUMNS = Set.of(
            "status", "last_error", "name", "operation", "filetypes", "trigger_type", "trigger_spec");

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final DateTimeFormatter TIMESTAMP = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .toFormatter();

    private static final DateTimeFormatter RUN_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    private static final String INSERT_POLICY = """
            INSERT INTO policy (id, name, policy_file, is_enabled, strategy, data_type, tags, paths, operations, triggers)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)""";

    private static final String INSERT_JOB = """
            INSERT INTO job (id, policy_id, name, operation, filetypes, trigger_type, trigger_spec, status)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)""";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public StateStore(DataSource dataSource) {
        this(dataSource, Clock.systemUTC());
    }

    public StateStore(DataSource dataSource, Clock clock) {
        this.jdbcTemplate = new JdbcTemplate(Objects.requireNonNull(dataSource, "dataSource"));
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Create a store backed by a SQLite file, creating parent directories and the schema if needed.
     *
     * @param dbPath Database file
     * @return Initialized store
     */
    public static StateStore sqlite(Path dbPath) {
        return sqlite(dbPath, new ClassPathResource(DEFAULT_SCHEMA));
    }

    /**
     * Create a store backed by a SQLite file, initialized from the given schema script.
     */
    public static StateStore sqlite(Path dbPath, Resource schema) {
        Path parent = dbPath.toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new PersistenceException("Cannot create database directory: " + parent, e);
            }
        }
        StateStore store = new StateStore(sqliteDataSource(dbPath));
        store.initialize(schema);
        return store;
    }

    /**
     * SQLite data source handing out a new connection per call, with foreign keys enforced.
     */
    public static DataSource sqliteDataSource(Path dbPath) {
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dbPath.toAbsolutePath());
        dataSource.setDriverClassName("org.sqlite.JDBC");
        Properties properties = new Properties();
        properties.setProperty("foreign_keys", "true");
        properties.setProperty("busy_timeout", "5000");
        dataSource.setConnectionProperties(properties);
        return dataSource;
    }

    /**
     * Run the schema script. Statements are idempotent.
     */
    public void initialize(Resource schema) {
        log.info("Initializing state store schema from {}", schema.getDescription());
        try {
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator(schema);
            populator.execute(Objects.requireNonNull(jdbcTemplate.getDataSource()));
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot initialize schema from " + schema.getDescription(), e);
        }
    }

    public void addPolicy(PolicyRow row) {
        Object[] values = {
                row.id(),
                row.name(),
                row.policyFile(),
                row.enabled() ? 1 : 0,
                row.strategy(),
                toJson(row.dataTypes()),
                toJson(row.tags()),
                toJson(row.paths()),
                toJson(row.operations()),
                toJson(row.triggers())
        };
        logStatement(INSERT_POLICY, values);
        try {
            jdbcTemplate.update(INSERT_POLICY, values);
        } catch (DataAccessException e) {
            log.error("Error adding policy {}: {}", row.id(), e.getMessage(), e);
            throw new PersistenceException("Cannot add policy " + row.id(), e);
        }
    }

    public void addJob(JobRow row) {
        Object[] values = {
                row.id(),
                row.policyId(),
                row.name(),
                row.operation(),
                row.filetypes(),
                row.triggerType(),
                toJson(row.triggerSpec()),
                row.status().label()
        };
        logStatement(INSERT_JOB, values);
        try {
            jdbcTemplate.update(INSERT_JOB, values);
        } catch (DataAccessException e) {
            log.error("Error adding job {}: {}", row.id(), e.getMessage(), e);
            throw new PersistenceException("Cannot add job " + row.id(), e);
        }
    }

    /**
     * Update the jobs of a policy. Only the supplied columns change; last_run_time is always stamped.
     *
     * @param policyId Owning policy id
     * @param fields   Column name to new value; status accepts a {@link JobStatus} or its label
     * @return false if the policy does not exist or the update failed
     * @throws IllegalArgumentException for a column that cannot be updated
     */
    public boolean updateJob(String policyId, Map<String, ?> fields) {
        for (String column : fields.keySet()) {
            if (!MUTABLE_JOB_COLUMNS.contains(column)) {
                throw new IllegalArgumentException("Job column cannot be updated: " + column);
            }
        }

        try {
            Integer policies = jdbcTemplate.queryForObject(
                    "SELECT COUNT(*) FROM policy WHERE id = ?", Integer.class, policyId);
            if (policies == null || policies == 0) {
                log.error("Cannot update jobs: policy with ID {} not found", policyId);
                return false;
            }

            List<String> assignments = new ArrayList<>();
            List<Object> values = new ArrayList<>();
            for (Map.Entry<String, ?> entry : fields.entrySet()) {
                assignments.add(entry.getKey() + " = ?");
                values.add(toColumnValue(entry.getKey(), entry.getValue()));
            }
            assignments.add("last_run_time = ?");
            values.add(RUN_TIMESTAMP.format(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC)));
            values.add(policyId);

            String sql = "UPDATE job SET " + String.join(", ", assignments) + " WHERE policy_id = ?";
            logStatement(sql, values.toArray());
            int updated = jdbcTemplate.update(sql, values.toArray());
            log.info("Updated {} job(s) for policy with ID: {}", updated, policyId);
            return true;
        } catch (DataAccessException e) {
            log.error("Error updating jobs of policy {}: {}", policyId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Delete a policy and its jobs in one transaction.
     *
     * @return true if a policy row was removed
     */
    public boolean deletePolicy(String policyId) {
        try {
            Boolean deleted = transactionTemplate.execute(status -> {
                jdbcTemplate.update("DELETE FROM job WHERE policy_id = ?", policyId);
                return jdbcTemplate.update("DELETE FROM policy WHERE id = ?", policyId) > 0;
            });
            if (Boolean.TRUE.equals(deleted)) {
                log.info("Deleted policy with ID: {}", policyId);
                return true;
            }
            log.warn("No policy found with ID: {}", policyId);
            return false;
        } catch (DataAccessException e) {
            log.error("Error deleting policy {}: {}", policyId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Delete every policy and its jobs.
     *
     * @return Ids of the removed policies
     */
    public List<String> removeAllPolicies() {
        List<String> removed = new ArrayList<>();
        List<String> ids;
        try {
            ids = jdbcTemplate.queryForList("SELECT id FROM policy", String.class);
        } catch (DataAccessException e) {
            log.error("Error listing policies for removal: {}", e.getMessage(), e);
            return removed;
        }
        for (String id : ids) {
            if (deletePolicy(id)) {
                removed.add(id);
            }
        }
        log.info("Removed {} policies", removed.size());
        return removed;
    }

    public Optional<PolicyRow> findPolicy(String policyId) {
        try {
            return jdbcTemplate.query("SELECT * FROM policy WHERE id = ?", policyRowMapper(), policyId)
                    .stream()
                    .findFirst();
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot read policy " + policyId, e);
        }
    }

    public List<PolicyRow> findAllPolicies() {
        try {
            return jdbcTemplate.query("SELECT * FROM policy ORDER BY created_at, id", policyRowMapper());
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot read policies", e);
        }
    }

    public List<JobRow> findJobsByPolicy(String policyId) {
        try {
            return jdbcTemplate.query("SELECT * FROM job WHERE policy_id = ? ORDER BY created_at, id",
                    jobRowMapper(), policyId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot read jobs of policy " + policyId, e);
        }
    }

    private Object toColumnValue(String column, Object value) {
        if (value == null) {
            return null;
        }
        if ("status".equals(column)) {
            JobStatus status = value instanceof JobStatus s ? s : JobStatus.fromLabel(value.toString());
            return status.label();
        }
        if ("trigger_spec".equals(column) && !(value instanceof String)) {
            return toJson(value);
        }
        return value;
    }

    private static RowMapper<PolicyRow> policyRowMapper() {
        return (rs, rowNum) -> new PolicyRow(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("policy_file"),
                rs.getInt("is_enabled") == 1,
                rs.getString("strategy"),
                fromJson(rs.getString("data_type"), new TypeReference<List<String>>() {}),
                fromJson(rs.getString("tags"), new TypeReference<List<String>>() {}),
                fromJson(rs.getString("paths"), new TypeReference<List<String>>() {}),
                fromJson(rs.getString("operations"), new TypeReference<List<String>>() {}),
                fromJson(rs.getString("triggers"), new TypeReference<List<Map<String, Object>>>() {}),
                parseTimestamp(rs.getString("created_at")),
                parseTimestamp(rs.getString("updated_at")));
    }

    private static RowMapper<JobRow> jobRowMapper() {
        return (rs, rowNum) -> {
            String status = rs.getString("status");
            return new JobRow(
                    rs.getString("id"),
                    rs.getString("policy_id"),
                    rs.getString("name"),
                    rs.getString("operation"),
                    rs.getString("filetypes"),
                    rs.getString("trigger_type"),
                    fromJson(rs.getString("trigger_spec"), new TypeReference<Map<String, Object>>() {}),
                    status != null ? JobStatus.fromLabel(status) : null,
                    rs.getString("last_error"),
                    parseTimestamp(rs.getString("created_at")),
                    parseTimestamp(rs.getString("last_run_time")));
        };
    }

    private static LocalDateTime parseTimestamp(String value) {
        return value != null ? LocalDateTime.parse(value, TIMESTAMP) : null;
    }

    static String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize column value: " + e.getMessage(), e);
        }
    }

    private static <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot parse column value: " + e.getMessage(), e);
        }
    }

    /**
     * Debug rendering of a statement with its arguments inlined. Never executed.
     */
    private static void logStatement(String sql, Object[] values) {
        if (!log.isDebugEnabled()) {
            return;
        }
        String rendered = sql;
        for (Object value : values) {
            String literal = value instanceof String ? "'" + value + "'" : String.valueOf(value);
            rendered = rendered.replaceFirst("\\?", Matcher.quoteReplacement(literal));
        }
        log.debug("Execute {}", rendered.replaceAll("\\s+", " "));
    }
}
