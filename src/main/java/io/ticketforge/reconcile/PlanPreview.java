package io.ticketforge.reconcile;

import io.ticketforge.plan.KindCounts;

import java.util.Map;

/**
 * Dry-run view of a plan: what a full run would create, per group.
 */
public record PlanPreview(
        String projectKey,
        String planFingerprint,
        int taskCount,
        Map<String, KindCounts> expectedByGroup,
        KindCounts expectedTotals
) {
}
