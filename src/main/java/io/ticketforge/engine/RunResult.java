package io.ticketforge.engine;

import io.ticketforge.model.TaskStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RunResult(
        String runId,
        long startedAtMs,
        long finishedAtMs,
        boolean aborted,
        int operationsDispatched,
        Map<String, TaskOutcome> outcomes
) {
    public RunResult {
        outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
    }

    public int count(TaskStatus status) {
        int n = 0;
        for (TaskOutcome outcome : outcomes.values()) {
            if (outcome.status() == status) {
                n++;
            }
        }
        return n;
    }

    public Map<TaskStatus, Integer> statusCounts() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, count(status));
        }
        return counts;
    }

    public List<String> taskIdsWith(TaskStatus status) {
        return outcomes.values().stream()
                .filter(o -> o.status() == status)
                .map(TaskOutcome::taskId)
                .sorted()
                .toList();
    }

    public boolean complete() {
        return !aborted && count(TaskStatus.DONE) == outcomes.size();
    }
}
