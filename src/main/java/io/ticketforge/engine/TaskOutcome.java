package io.ticketforge.engine;

import io.ticketforge.model.FailureKind;
import io.ticketforge.model.TaskOperation;
import io.ticketforge.model.TaskStatus;

/**
 * Final state of one plan task after a run. {@code executedThisRun} is false
 * for tasks satisfied or failed by an earlier run and for tasks never reached.
 */
public record TaskOutcome(
        String taskId,
        String groupKey,
        TaskOperation operation,
        TaskStatus status,
        String remoteKey,
        String error,
        FailureKind failureKind,
        boolean executedThisRun
) {
}
