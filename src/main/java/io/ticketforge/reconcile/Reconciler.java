package io.ticketforge.reconcile;

import io.ticketforge.model.CheckpointRecord;
import io.ticketforge.model.TaskStatus;
import io.ticketforge.plan.CreateTask;
import io.ticketforge.plan.CreationTask;
import io.ticketforge.plan.KindCounts;
import io.ticketforge.plan.PlanBuilder;
import io.ticketforge.plan.RunPlan;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Compares what a plan expects with what the checkpoint says was realised.
 * Works from checkpoint state only and never calls the tracker.
 */
public final class Reconciler {
    private final LongSupplier clock;

    public Reconciler() {
        this(System::currentTimeMillis);
    }

    public Reconciler(LongSupplier clock) {
        this.clock = clock;
    }

    public PlanPreview preview(RunPlan plan) {
        return new PlanPreview(
                plan.projectKey(),
                plan.fingerprint(),
                plan.size(),
                plan.expectedByGroup(),
                plan.expectedTotals()
        );
    }

    public ReconciliationReport reconcile(RunPlan plan, Map<String, CheckpointRecord> checkpoint) {
        Map<String, KindCounts> actualByGroup = new LinkedHashMap<>();
        for (String group : plan.groupKeys()) {
            actualByGroup.put(group, KindCounts.ZERO);
        }
        List<TaskIssue> failed = new ArrayList<>();
        List<TaskIssue> skipped = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        List<String> inProgress = new ArrayList<>();
        List<String> violations = new ArrayList<>();

        for (CreationTask task : plan.tasks()) {
            if (task instanceof CreateTask create && PlanBuilder.mixesAcceptanceCriteria(create.record())) {
                violations.add(task.id());
            }
            CheckpointRecord record = checkpoint.get(task.id());
            TaskStatus status = record == null ? TaskStatus.PENDING : record.status();
            switch (status) {
                case DONE -> actualByGroup.merge(task.groupKey(), countOf(task), KindCounts::plus);
                case FAILED -> failed.add(issue(task, record));
                case SKIPPED -> skipped.add(issue(task, record));
                case IN_PROGRESS -> inProgress.add(task.id());
                case PENDING -> pending.add(task.id());
            }
        }

        List<GroupReconciliation> groups = new ArrayList<>();
        KindCounts actualTotals = KindCounts.ZERO;
        for (Map.Entry<String, KindCounts> entry : plan.expectedByGroup().entrySet()) {
            KindCounts actual = actualByGroup.getOrDefault(entry.getKey(), KindCounts.ZERO);
            actualTotals = actualTotals.plus(actual);
            groups.add(new GroupReconciliation(entry.getKey(), entry.getValue(), actual, entry.getValue().minus(actual)));
        }
        KindCounts expectedTotals = plan.expectedTotals();
        return new ReconciliationReport(
                plan.projectKey(),
                plan.fingerprint(),
                clock.getAsLong(),
                groups,
                expectedTotals,
                actualTotals,
                expectedTotals.minus(actualTotals),
                failed,
                skipped,
                pending,
                inProgress,
                violations
        );
    }

    private static KindCounts countOf(CreationTask task) {
        return switch (task.operation()) {
            case CREATE -> KindCounts.ZERO.withCreate(((CreateTask) task).kind());
            case LINK -> KindCounts.ZERO.withLink();
            case SET_FIELD -> KindCounts.ZERO.withFieldUpdate();
        };
    }

    private static TaskIssue issue(CreationTask task, CheckpointRecord record) {
        return new TaskIssue(
                task.id(),
                task.groupKey(),
                task.operation(),
                record.status(),
                record.failureKind(),
                record.error(),
                record.attempts()
        );
    }
}
