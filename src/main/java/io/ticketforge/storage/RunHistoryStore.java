package io.ticketforge.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One row per engine run: which plan it executed and how it ended.
 */
public final class RunHistoryStore {
    private final Database database;
    private final String namespace;

    public RunHistoryStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public void recordStarted(String runId, String planFingerprint, int tasksTotal, long nowMs) {
        String sql = "INSERT INTO runs(run_id,namespace,plan_fingerprint,status,tasks_total,started_at_ms) VALUES(?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, namespace);
            ps.setString(3, planFingerprint);
            ps.setString(4, "RUNNING");
            ps.setInt(5, tasksTotal);
            ps.setLong(6, nowMs);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to record run start " + runId, e);
        }
    }

    public void recordFinished(String runId, String status, int done, int failed, int skipped, int remoteCalls, long nowMs) {
        String sql = "UPDATE runs SET status=?,tasks_done=?,tasks_failed=?,tasks_skipped=?,remote_calls=?,finished_at_ms=? WHERE run_id=? AND namespace=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, status);
            ps.setInt(2, done);
            ps.setInt(3, failed);
            ps.setInt(4, skipped);
            ps.setInt(5, remoteCalls);
            ps.setLong(6, nowMs);
            ps.setString(7, runId);
            ps.setString(8, namespace);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to record run finish " + runId, e);
        }
    }

    public Optional<RunRow> latest() {
        List<RunRow> rows = list(1);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<RunRow> list(int limit) {
        String sql = """
                SELECT run_id,plan_fingerprint,status,tasks_total,tasks_done,tasks_failed,tasks_skipped,remote_calls,started_at_ms,finished_at_ms
                FROM runs WHERE namespace=? ORDER BY started_at_ms DESC, rowid DESC LIMIT ?
                """;
        List<RunRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setInt(2, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long finished = rs.getLong("finished_at_ms");
                    boolean unfinished = rs.wasNull();
                    out.add(new RunRow(
                            rs.getString("run_id"),
                            rs.getString("plan_fingerprint"),
                            rs.getString("status"),
                            rs.getInt("tasks_total"),
                            rs.getInt("tasks_done"),
                            rs.getInt("tasks_failed"),
                            rs.getInt("tasks_skipped"),
                            rs.getInt("remote_calls"),
                            rs.getLong("started_at_ms"),
                            unfinished ? null : finished
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new CheckpointStoreException("Failed to list runs", e);
        }
    }

    public record RunRow(
            String runId,
            String planFingerprint,
            String status,
            int tasksTotal,
            int tasksDone,
            int tasksFailed,
            int tasksSkipped,
            int remoteCalls,
            long startedAtMs,
            Long finishedAtMs
    ) {
    }
}
