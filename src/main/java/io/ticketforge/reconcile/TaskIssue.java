package io.ticketforge.reconcile;

import io.ticketforge.model.FailureKind;
import io.ticketforge.model.TaskOperation;
import io.ticketforge.model.TaskStatus;

public record TaskIssue(
        String taskId,
        String groupKey,
        TaskOperation operation,
        TaskStatus status,
        FailureKind failureKind,
        String error,
        int attempts
) {
}
