package io.ticketforge.storage;

import io.ticketforge.model.CheckpointRecord;
import io.ticketforge.model.FailureKind;
import io.ticketforge.model.TaskStatus;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint store backed by the {@code checkpoints} table. Each {@link #put}
 * is its own committed statement on a {@code synchronous=FULL} connection.
 */
public final class SqliteCheckpointStore implements CheckpointStore {
    private static final String COLUMNS = "task_id,status,remote_key,last_error,failure_kind,attempts,run_id,updated_at_ms";

    private final Database database;
    private final String namespace;

    public SqliteCheckpointStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    @Override
    public Optional<CheckpointRecord> get(String taskId) {
        String sql = "SELECT " + COLUMNS + " FROM checkpoints WHERE namespace=? AND task_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to read checkpoint " + taskId, e);
        }
    }

    @Override
    public synchronized void put(CheckpointRecord record) {
        String sql = """
                INSERT INTO checkpoints(namespace,task_id,status,remote_key,last_error,failure_kind,attempts,run_id,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(namespace,task_id) DO UPDATE SET
                    status=excluded.status,
                    remote_key=excluded.remote_key,
                    last_error=excluded.last_error,
                    failure_kind=excluded.failure_kind,
                    attempts=excluded.attempts,
                    run_id=excluded.run_id,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, record.taskId());
            ps.setString(3, record.status().name());
            ps.setString(4, record.remoteKey());
            ps.setString(5, record.error());
            ps.setString(6, record.failureKind() == null ? null : record.failureKind().name());
            ps.setInt(7, record.attempts());
            ps.setString(8, record.runId());
            ps.setLong(9, record.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to write checkpoint " + record.taskId(), e);
        }
    }

    @Override
    public Map<String, CheckpointRecord> load() {
        String sql = "SELECT " + COLUMNS + " FROM checkpoints WHERE namespace=? ORDER BY updated_at_ms, task_id";
        Map<String, CheckpointRecord> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    CheckpointRecord record = read(rs);
                    out.put(record.taskId(), record);
                }
            }
            return out;
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to load checkpoints", e);
        }
    }

    @Override
    public synchronized boolean clear(String taskId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM checkpoints WHERE namespace=? AND task_id=?")) {
            ps.setString(1, namespace);
            ps.setString(2, taskId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to clear checkpoint " + taskId, e);
        }
    }

    private CheckpointRecord read(ResultSet rs) throws SQLException {
        String failureKind = rs.getString("failure_kind");
        return new CheckpointRecord(
                rs.getString("task_id"),
                TaskStatus.fromString(rs.getString("status")),
                rs.getString("remote_key"),
                rs.getString("last_error"),
                failureKind == null || failureKind.isBlank() ? null : FailureKind.valueOf(failureKind),
                rs.getInt("attempts"),
                rs.getString("run_id"),
                rs.getLong("updated_at_ms")
        );
    }
}
