package io.bankseed.storage;

import io.bankseed.config.BankSeedConfig;
import io.bankseed.error.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

public final class Database {
    private static final Logger logger = LogManager.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "bankseed.schema.migration.v1";

    private final BankSeedConfig config;
    private final String jdbcUrl;
    private final long storageTimeoutMs;

    public Database(BankSeedConfig config, long storageTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.storageTimeoutMs = Math.max(1_000L, storageTimeoutMs);
    }

    public BankSeedConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Long.toString(storageTimeoutMs));
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    /**
     * Prepares a statement bounded by the storage timeout.
     */
    public PreparedStatement prepare(Connection conn, String sql) throws SQLException {
        PreparedStatement ps = conn.prepareStatement(sql);
        ps.setQueryTimeout(queryTimeoutSeconds());
        return ps;
    }

    public int queryTimeoutSeconds() {
        return (int) Math.max(1L, (storageTimeoutMs + 999L) / 1000L);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new PersistenceException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS gen_tasks (
                        task_id TEXT PRIMARY KEY,
                        kind TEXT NOT NULL,
                        status TEXT NOT NULL,
                        schedule_kind TEXT NOT NULL,
                        lineage_key TEXT NOT NULL,
                        lineage_tag TEXT NOT NULL,
                        window_start_ms INTEGER NOT NULL,
                        window_end_ms INTEGER NOT NULL,
                        data_horizon_ms INTEGER NOT NULL,
                        start_time_ms INTEGER,
                        end_time_ms INTEGER,
                        current_stage TEXT,
                        next_scheduled_at_ms INTEGER,
                        last_successful_at_ms INTEGER,
                        last_error TEXT,
                        attempt INTEGER NOT NULL DEFAULT 0,
                        needs_attention INTEGER NOT NULL DEFAULT 0,
                        control_request TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_checkpoints (
                        checkpoint_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL,
                        lineage_key TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        payload TEXT NOT NULL,
                        UNIQUE(lineage_key, seq),
                        FOREIGN KEY(task_id) REFERENCES gen_tasks(task_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS validation_results (
                        result_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id TEXT NOT NULL,
                        entity_type TEXT NOT NULL,
                        recorded_at_ms INTEGER NOT NULL,
                        total_count INTEGER NOT NULL,
                        passed_count INTEGER NOT NULL,
                        failed_count INTEGER NOT NULL,
                        details TEXT,
                        error_samples TEXT,
                        FOREIGN KEY(task_id) REFERENCES gen_tasks(task_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS generated_records (
                        record_id TEXT PRIMARY KEY,
                        entity_type TEXT NOT NULL,
                        target_table TEXT NOT NULL,
                        lineage_key TEXT NOT NULL,
                        task_id TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        base_id TEXT NOT NULL,
                        logical_time_ms INTEGER NOT NULL,
                        payload TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_task_indexes",
                "Index tasks by kind/status and lineage",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_gen_tasks_kind_status ON gen_tasks(kind, status)",
                        "CREATE INDEX IF NOT EXISTS idx_gen_tasks_lineage ON gen_tasks(lineage_key, created_at_ms)",
                        "CREATE INDEX IF NOT EXISTS idx_checkpoints_lineage ON task_checkpoints(lineage_key, seq)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_record_lookup",
                "Index generated records for identifier reload",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_records_lineage_type_seq ON generated_records(lineage_key, entity_type, seq)",
                        "CREATE INDEX IF NOT EXISTS idx_records_type ON generated_records(entity_type)",
                        "CREATE INDEX IF NOT EXISTS idx_validation_task ON validation_results(task_id, entity_type)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
            logger.info("Applied schema migration {}", step.version());
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new PersistenceException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = prepare(c,
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new PersistenceException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
