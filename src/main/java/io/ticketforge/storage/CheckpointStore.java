package io.ticketforge.storage;

import io.ticketforge.model.CheckpointRecord;

import java.util.Map;
import java.util.Optional;

/**
 * Durable task id to outcome mapping that lets an interrupted run resume.
 *
 * <p>{@link #put} returns only after the record is on disk. Implementations
 * assume a single writer: running two engines against one store at the same
 * time is not supported and not detected.
 */
public interface CheckpointStore extends AutoCloseable {
    Optional<CheckpointRecord> get(String taskId);

    void put(CheckpointRecord record);

    Map<String, CheckpointRecord> load();

    /**
     * Removes an entry so the task is attempted again on the next run.
     *
     * @return true if an entry existed
     */
    boolean clear(String taskId);

    @Override
    default void close() {
    }
}
