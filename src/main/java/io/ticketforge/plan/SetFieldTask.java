package io.ticketforge.plan;

import io.ticketforge.model.TaskOperation;

import java.util.List;

public record SetFieldTask(
        String id,
        String groupKey,
        List<String> dependsOn,
        String targetTaskId,
        String fieldName,
        String value
) implements CreationTask {
    public SetFieldTask {
        dependsOn = List.copyOf(dependsOn);
    }

    @Override
    public TaskOperation operation() {
        return TaskOperation.SET_FIELD;
    }
}
