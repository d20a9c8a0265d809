package io.ticketforge.plan;

import io.ticketforge.model.RecordKind;
import io.ticketforge.model.RecordSpec;
import io.ticketforge.model.TaskOperation;

import java.util.List;

/**
 * Creates one remote record. {@code parentTaskId} names the story create whose
 * remote key becomes the parent of a sub-task; it is null for other kinds.
 */
public record CreateTask(
        String id,
        String groupKey,
        List<String> dependsOn,
        RecordSpec record,
        String parentTaskId,
        String projectKey,
        List<String> labels
) implements CreationTask {
    public CreateTask {
        dependsOn = List.copyOf(dependsOn);
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    @Override
    public TaskOperation operation() {
        return TaskOperation.CREATE;
    }

    public RecordKind kind() {
        return record.kind();
    }
}
