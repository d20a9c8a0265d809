package io.ticketforge.reconcile;

import io.ticketforge.plan.KindCounts;

import java.util.List;

/**
 * Data content of a reconciliation: per-group and aggregate discrepancies
 * between the plan and the checkpoint, plus every task that did not reach
 * DONE.
 */
public record ReconciliationReport(
        String projectKey,
        String planFingerprint,
        long generatedAtMs,
        List<GroupReconciliation> groups,
        KindCounts expectedTotals,
        KindCounts actualTotals,
        KindCounts missingTotals,
        List<TaskIssue> failed,
        List<TaskIssue> skipped,
        List<String> pending,
        List<String> inProgress,
        List<String> separationViolations
) {
    public ReconciliationReport {
        groups = List.copyOf(groups);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
        pending = List.copyOf(pending);
        inProgress = List.copyOf(inProgress);
        separationViolations = List.copyOf(separationViolations);
    }

    public boolean balanced() {
        return missingTotals.isZero() && separationViolations.isEmpty();
    }

    public List<String> unbalancedGroups() {
        return groups.stream()
                .filter(g -> !g.balanced())
                .map(GroupReconciliation::groupKey)
                .toList();
    }
}
