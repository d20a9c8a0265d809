package io.ticketforge.plan;

import io.ticketforge.util.Hashing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable output of {@link PlanBuilder}: tasks in dependency order plus the
 * counts a complete run is expected to produce, per group key.
 */
public final class RunPlan {
    private final String projectKey;
    private final List<CreationTask> tasks;
    private final Map<String, CreationTask> byId;
    private final Map<String, KindCounts> expectedByGroup;
    private final Map<String, List<String>> dependents;
    private final String fingerprint;

    RunPlan(String projectKey, List<CreationTask> tasks, Map<String, KindCounts> expectedByGroup) {
        this.projectKey = projectKey;
        this.tasks = List.copyOf(tasks);
        Map<String, CreationTask> index = new LinkedHashMap<>();
        Map<String, List<String>> reverse = new LinkedHashMap<>();
        for (CreationTask task : this.tasks) {
            index.put(task.id(), task);
            reverse.putIfAbsent(task.id(), new ArrayList<>());
        }
        for (CreationTask task : this.tasks) {
            for (String dep : task.dependsOn()) {
                reverse.computeIfAbsent(dep, k -> new ArrayList<>()).add(task.id());
            }
        }
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        reverse.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        this.byId = Collections.unmodifiableMap(index);
        this.dependents = Collections.unmodifiableMap(frozen);
        this.expectedByGroup = Collections.unmodifiableMap(new LinkedHashMap<>(expectedByGroup));
        this.fingerprint = computeFingerprint(this.tasks);
    }

    public String projectKey() {
        return projectKey;
    }

    public List<CreationTask> tasks() {
        return tasks;
    }

    public Optional<CreationTask> task(String taskId) {
        return Optional.ofNullable(byId.get(taskId));
    }

    public int size() {
        return tasks.size();
    }

    public List<String> groupKeys() {
        return List.copyOf(expectedByGroup.keySet());
    }

    public Map<String, KindCounts> expectedByGroup() {
        return expectedByGroup;
    }

    public KindCounts expectedTotals() {
        KindCounts total = KindCounts.ZERO;
        for (KindCounts counts : expectedByGroup.values()) {
            total = total.plus(counts);
        }
        return total;
    }

    /**
     * Direct dependents of a task, in plan order.
     */
    public List<String> dependentsOf(String taskId) {
        return dependents.getOrDefault(taskId, List.of());
    }

    public String fingerprint() {
        return fingerprint;
    }

    private static String computeFingerprint(List<CreationTask> tasks) {
        StringBuilder sb = new StringBuilder();
        for (CreationTask task : tasks) {
            sb.append(task.id())
                    .append('|')
                    .append(task.operation().name())
                    .append('|')
                    .append(String.join(",", task.dependsOn()))
                    .append('\n');
        }
        return Hashing.sha256Hex(sb.toString());
    }
}
