package io.ticketforge.storage;

import io.ticketforge.config.ProvisionerConfig;
import io.ticketforge.model.CheckpointRecord;
import io.ticketforge.model.FailureKind;
import io.ticketforge.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class SqliteCheckpointStoreTest {

    @Test
    void putOverwritesAndLoadReturnsLatestState() throws Exception {
        Path root = Files.createTempDirectory("ticketforge-test-sqlite-store-");
        try {
            Database db = new Database(ProvisionerConfig.fromRoot(root.toString()));
            db.init();
            SqliteCheckpointStore store = new SqliteCheckpointStore(db);

            store.put(CheckpointRecord.inProgress("g:feature:1", 1, "run_a", 100L));
            store.put(CheckpointRecord.done("g:feature:1", "MIG-10", 1, "run_a", 110L));
            store.put(CheckpointRecord.failed("g:story:1", "HTTP 400: bad issue type", FailureKind.PERMANENT, 1, "run_a", 120L));

            Optional<CheckpointRecord> feature = store.get("g:feature:1");
            Assertions.assertTrue(feature.isPresent());
            Assertions.assertEquals(TaskStatus.DONE, feature.get().status());
            Assertions.assertEquals("MIG-10", feature.get().remoteKey());

            Map<String, CheckpointRecord> all = store.load();
            Assertions.assertEquals(List.of("g:feature:1", "g:story:1"), List.copyOf(all.keySet()));
            CheckpointRecord story = all.get("g:story:1");
            Assertions.assertEquals(FailureKind.PERMANENT, story.failureKind());
            Assertions.assertEquals("HTTP 400: bad issue type", story.error());
            Assertions.assertTrue(store.get("missing").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void clearRemovesOnlyTheNamedEntry() throws Exception {
        Path root = Files.createTempDirectory("ticketforge-test-sqlite-clear-");
        try {
            Database db = new Database(ProvisionerConfig.fromRoot(root.toString()));
            db.init();
            SqliteCheckpointStore store = new SqliteCheckpointStore(db);
            store.put(CheckpointRecord.failed("a", "boom", FailureKind.TRANSIENT, 5, "run_a", 1L));
            store.put(CheckpointRecord.done("b", "MIG-2", 1, "run_a", 2L));

            Assertions.assertTrue(store.clear("a"));
            Assertions.assertFalse(store.clear("a"));
            Assertions.assertEquals(List.of("b"), List.copyOf(store.load().keySet()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void namespacesDoNotShareCheckpoints() throws Exception {
        Path root = Files.createTempDirectory("ticketforge-test-sqlite-ns-");
        try {
            Database first = new Database(ProvisionerConfig.fromRoot(root.toString(), "migration-one"));
            Database second = new Database(ProvisionerConfig.fromRoot(root.toString(), "migration-two"));
            first.init();
            second.init();
            new SqliteCheckpointStore(first).put(CheckpointRecord.done("t", "MIG-1", 1, "run_a", 1L));

            Assertions.assertTrue(new SqliteCheckpointStore(second).load().isEmpty());
            Assertions.assertEquals(1, new SqliteCheckpointStore(first).load().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void initIsIdempotentAndRunsInWalMode() throws Exception {
        Path root = Files.createTempDirectory("ticketforge-test-sqlite-init-");
        try {
            Database db = new Database(ProvisionerConfig.fromRoot(root.toString()));
            db.init();
            db.init();
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals("wal", rs.getString(1).toLowerCase());
                }
                try (ResultSet rs = st.executeQuery("PRAGMA synchronous")) {
                    Assertions.assertTrue(rs.next());
                    Assertions.assertEquals(2, rs.getInt(1));
                }
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runHistoryTracksStartAndFinish() throws Exception {
        Path root = Files.createTempDirectory("ticketforge-test-run-history-");
        try {
            Database db = new Database(ProvisionerConfig.fromRoot(root.toString()));
            db.init();
            RunHistoryStore history = new RunHistoryStore(db);
            history.recordStarted("run_a", "fp1", 10, 1_000L);
            history.recordStarted("run_b", "fp2", 12, 2_000L);
            history.recordFinished("run_a", "COMPLETED", 10, 0, 0, 10, 1_500L);

            List<RunHistoryStore.RunRow> rows = history.list(10);
            Assertions.assertEquals(2, rows.size());
            RunHistoryStore.RunRow latest = history.latest().orElseThrow();
            Assertions.assertEquals("run_b", latest.runId());
            Assertions.assertNull(latest.finishedAtMs());
            RunHistoryStore.RunRow finished = rows.stream().filter(r -> r.runId().equals("run_a")).findFirst().orElseThrow();
            Assertions.assertEquals("COMPLETED", finished.status());
            Assertions.assertEquals(Long.valueOf(1_500L), finished.finishedAtMs());
            Assertions.assertEquals(10, finished.remoteCalls());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
