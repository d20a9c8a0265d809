package io.ticketforge.plan;

import io.ticketforge.model.TaskOperation;

import java.util.List;

/**
 * Relates the remote record created by {@code sourceTaskId} (a story) to the
 * one created by {@code targetTaskId} (its feature). Link type names differ
 * between tracker instances, so the task carries an ordered list of
 * acceptable names; the first one the tracker accepts is used.
 */
public record LinkTask(
        String id,
        String groupKey,
        List<String> dependsOn,
        String sourceTaskId,
        String targetTaskId,
        List<String> linkTypeCandidates
) implements CreationTask {
    public LinkTask {
        dependsOn = List.copyOf(dependsOn);
        linkTypeCandidates = List.copyOf(linkTypeCandidates);
    }

    @Override
    public TaskOperation operation() {
        return TaskOperation.LINK;
    }
}
