package io.ticketforge.storage;

import io.ticketforge.config.ProvisionerConfig;
import io.ticketforge.util.Hashing;

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

public final class Database {
    private final ProvisionerConfig config;
    private final String jdbcUrl;

    public Database(ProvisionerConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            // synchronous is per connection; FULL makes every commit durable before it returns.
            st.execute("PRAGMA synchronous=FULL");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.reportsRoot());
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS checkpoints (
                        task_id TEXT NOT NULL,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        status TEXT NOT NULL,
                        remote_key TEXT,
                        last_error TEXT,
                        failure_kind TEXT,
                        attempts INTEGER NOT NULL DEFAULT 0,
                        run_id TEXT,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(namespace, task_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        run_id TEXT PRIMARY KEY,
                        namespace TEXT NOT NULL DEFAULT 'default',
                        plan_fingerprint TEXT NOT NULL,
                        status TEXT NOT NULL,
                        tasks_total INTEGER NOT NULL,
                        tasks_done INTEGER NOT NULL DEFAULT 0,
                        tasks_failed INTEGER NOT NULL DEFAULT 0,
                        tasks_skipped INTEGER NOT NULL DEFAULT 0,
                        remote_calls INTEGER NOT NULL DEFAULT 0,
                        started_at_ms INTEGER NOT NULL,
                        finished_at_ms INTEGER
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_checkpoints_namespace_status ON checkpoints(namespace, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_namespace_started ON runs(namespace, started_at_ms)");
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to initialize SQLite schema", e);
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
                "20261001_001_checkpoint_updated_index",
                "Index checkpoints by update time for audit queries",
                List.of("CREATE INDEX IF NOT EXISTS idx_checkpoints_updated ON checkpoints(namespace, updated_at_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
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
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement mark = conn.prepareStatement(
                     "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            for (String sql : step.statements()) {
                st.execute(sql);
            }
            mark.setString(1, step.version());
            mark.setString(2, step.description());
            mark.setString(3, Hashing.sha256Hex(String.join("\n", step.statements())));
            mark.setLong(4, Instant.now().toEpochMilli());
            mark.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "2");
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !expected.equalsIgnoreCase(actual.trim())) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private record MigrationStep(String version, String description, List<String> statements) {
    }
}
