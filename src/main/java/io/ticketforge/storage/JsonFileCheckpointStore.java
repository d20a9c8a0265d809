package io.ticketforge.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.ticketforge.model.CheckpointRecord;
import io.ticketforge.util.Jsons;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checkpoint store kept as a single JSON state file. Every change rewrites the
 * file through a synced temp file and an atomic rename, so a crash leaves
 * either the previous or the new state on disk, never a torn one.
 */
public final class JsonFileCheckpointStore implements CheckpointStore {
    private static final int FORMAT_VERSION = 1;

    private final Path stateFile;
    private final Map<String, CheckpointRecord> entries;

    public JsonFileCheckpointStore(Path stateFile) {
        this.stateFile = stateFile;
        this.entries = new LinkedHashMap<>(readState(stateFile));
    }

    @Override
    public synchronized Optional<CheckpointRecord> get(String taskId) {
        return Optional.ofNullable(entries.get(taskId));
    }

    @Override
    public synchronized void put(CheckpointRecord record) {
        CheckpointRecord previous = entries.put(record.taskId(), record);
        try {
            flush();
        } catch (RuntimeException e) {
            if (previous == null) {
                entries.remove(record.taskId());
            } else {
                entries.put(record.taskId(), previous);
            }
            throw e;
        }
    }

    @Override
    public synchronized Map<String, CheckpointRecord> load() {
        return new LinkedHashMap<>(entries);
    }

    @Override
    public synchronized boolean clear(String taskId) {
        if (!entries.containsKey(taskId)) {
            return false;
        }
        Map<String, CheckpointRecord> before = new LinkedHashMap<>(entries);
        entries.remove(taskId);
        try {
            flush();
        } catch (RuntimeException e) {
            entries.clear();
            entries.putAll(before);
            throw e;
        }
        return true;
    }

    private void flush() {
        StateFile state = new StateFile(FORMAT_VERSION, new LinkedHashMap<>(entries));
        byte[] bytes = Jsons.toJson(state).getBytes(StandardCharsets.UTF_8);
        Path tmp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            Path parent = stateFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (FileChannel ch = FileChannel.open(tmp,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    ch.write(buffer);
                }
                ch.force(true);
            }
            try {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to write checkpoint state file: " + stateFile, e);
        }
    }

    private static Map<String, CheckpointRecord> readState(Path stateFile) {
        if (!Files.isRegularFile(stateFile)) {
            return Map.of();
        }
        try {
            StateFile state = Jsons.mapper().readValue(stateFile.toFile(), new TypeReference<StateFile>() {
            });
            if (state == null || state.entries() == null) {
                return Map.of();
            }
            return state.entries();
        } catch (IOException e) {
            throw new CheckpointStoreException("Failed to read checkpoint state file: " + stateFile, e);
        }
    }

    private record StateFile(int version, Map<String, CheckpointRecord> entries) {
    }
}
