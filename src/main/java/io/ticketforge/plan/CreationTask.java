package io.ticketforge.plan;

import io.ticketforge.model.TaskOperation;

import java.util.List;

/**
 * One node of a {@link RunPlan}. Ids are derived from the group key, record
 * kind and position in the manifest, so the same input always yields the same
 * ids and a later run can match the checkpoint of an earlier one.
 */
public interface CreationTask {
    String id();

    String groupKey();

    TaskOperation operation();

    List<String> dependsOn();
}
