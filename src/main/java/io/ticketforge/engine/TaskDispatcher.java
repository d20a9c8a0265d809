package io.ticketforge.engine;

import io.ticketforge.client.CreateRequest;
import io.ticketforge.client.LinkResult;
import io.ticketforge.client.TrackerClient;
import io.ticketforge.model.RecordKind;
import io.ticketforge.model.RecordSpec;
import io.ticketforge.plan.CreateTask;
import io.ticketforge.plan.CreationTask;
import io.ticketforge.plan.LinkTask;
import io.ticketforge.plan.SetFieldTask;

import java.util.Map;

/**
 * Turns a plan task whose dependencies are done into the matching tracker
 * call. Remote keys of dependencies are resolved on the coordinator thread
 * before the call is handed to a worker.
 */
final class TaskDispatcher {
    private final TrackerClient client;

    TaskDispatcher(TrackerClient client) {
        this.client = client;
    }

    PreparedCall prepare(CreationTask task, Map<String, String> remoteKeys) {
        if (task instanceof CreateTask create) {
            RecordSpec record = create.record();
            String parentKey = create.parentTaskId() == null ? null : requireKey(remoteKeys, create.parentTaskId(), task);
            String epicKey = record.kind() == RecordKind.FEATURE ? record.epicRef() : null;
            CreateRequest request = new CreateRequest(
                    create.projectKey(),
                    record.kind(),
                    record.summary(),
                    record.description(),
                    parentKey,
                    epicKey,
                    create.labels()
            );
            return () -> new CallResult(client.create(record.kind(), request), null);
        }
        if (task instanceof LinkTask link) {
            String source = requireKey(remoteKeys, link.sourceTaskId(), task);
            String target = requireKey(remoteKeys, link.targetTaskId(), task);
            return () -> {
                LinkResult result = client.link(source, target, link.linkTypeCandidates());
                return new CallResult(null, result.linkType());
            };
        }
        if (task instanceof SetFieldTask setField) {
            String target = requireKey(remoteKeys, setField.targetTaskId(), task);
            return () -> {
                client.setField(target, setField.fieldName(), setField.value());
                return new CallResult(null, null);
            };
        }
        throw new IllegalArgumentException("Unsupported task type: " + task.getClass().getName());
    }

    private static String requireKey(Map<String, String> remoteKeys, String taskId, CreationTask dependent) {
        String key = remoteKeys.get(taskId);
        if (key == null || key.isBlank()) {
            throw new IllegalStateException("Task " + dependent.id() + " dispatched before " + taskId + " produced a remote key");
        }
        return key;
    }

    @FunctionalInterface
    interface PreparedCall {
        CallResult call();
    }

    record CallResult(String remoteKey, String linkType) {
    }
}
