package io.ticketforge.model;

/**
 * Persisted outcome of one plan task. {@code remoteKey} is set once a create
 * reaches {@link TaskStatus#DONE}; {@code error} and {@code failureKind} are
 * set for {@link TaskStatus#FAILED} and {@link TaskStatus#SKIPPED}.
 */
public record CheckpointRecord(
        String taskId,
        TaskStatus status,
        String remoteKey,
        String error,
        FailureKind failureKind,
        int attempts,
        String runId,
        long updatedAtMs
) {
    public static CheckpointRecord inProgress(String taskId, int attempts, String runId, long nowMs) {
        return new CheckpointRecord(taskId, TaskStatus.IN_PROGRESS, null, null, null, attempts, runId, nowMs);
    }

    public static CheckpointRecord done(String taskId, String remoteKey, int attempts, String runId, long nowMs) {
        return new CheckpointRecord(taskId, TaskStatus.DONE, remoteKey, null, null, attempts, runId, nowMs);
    }

    public static CheckpointRecord failed(String taskId, String error, FailureKind kind, int attempts, String runId, long nowMs) {
        return new CheckpointRecord(taskId, TaskStatus.FAILED, null, error, kind, attempts, runId, nowMs);
    }

    public static CheckpointRecord skipped(String taskId, String error, int attempts, String runId, long nowMs) {
        return new CheckpointRecord(taskId, TaskStatus.SKIPPED, null, error, FailureKind.DEPENDENCY_FAILED, attempts, runId, nowMs);
    }

    public boolean isDone() {
        return status == TaskStatus.DONE;
    }
}
