package io.ticketforge.reconcile;

import io.ticketforge.plan.KindCounts;

/**
 * Expected versus realised counts for one group. {@code missing} is
 * {@code expected - actual} per kind.
 */
public record GroupReconciliation(String groupKey, KindCounts expected, KindCounts actual, KindCounts missing) {
    public boolean balanced() {
        return missing.isZero();
    }
}
