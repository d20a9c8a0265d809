package io.ticketforge.engine;

import io.ticketforge.client.TrackerClient;
import io.ticketforge.client.TrackerException;
import io.ticketforge.model.CheckpointRecord;
import io.ticketforge.model.FailureKind;
import io.ticketforge.model.TaskStatus;
import io.ticketforge.observability.RunAuditLog;
import io.ticketforge.plan.CreationTask;
import io.ticketforge.plan.RunPlan;
import io.ticketforge.storage.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Walks a {@link RunPlan} in dependency order and realises each task through
 * a {@link TrackerClient}, recording every status change in a
 * {@link CheckpointStore} before moving on.
 *
 * <p>Scheduling: tasks of one group key run one at a time in plan order;
 * different groups run in parallel on a bounded pool. A single coordinator
 * thread (the caller of {@link #run}) owns all run state; workers only perform
 * the remote call and the checkpoint writes for their task.
 *
 * <p>Failures stay local to their branch: when a task fails, every task that
 * transitively depends on it is recorded {@link TaskStatus#SKIPPED} and never
 * attempted, while unrelated groups continue.
 */
public final class ProvisioningEngine {
    private static final Logger log = LoggerFactory.getLogger(ProvisioningEngine.class);
    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final int workerThreads;
    private final RunAuditLog auditLog;
    private final LongSupplier clock;
    private volatile Run active;

    public ProvisioningEngine(int workerThreads) {
        this(workerThreads, null, System::currentTimeMillis);
    }

    public ProvisioningEngine(int workerThreads, RunAuditLog auditLog) {
        this(workerThreads, auditLog, System::currentTimeMillis);
    }

    public ProvisioningEngine(int workerThreads, RunAuditLog auditLog, LongSupplier clock) {
        this.workerThreads = Math.max(1, workerThreads);
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * Stops dispatching new tasks. Calls already in flight complete and write
     * their checkpoint entries; {@link #run} then returns with
     * {@link RunResult#aborted()} set. Ignored when no run is in progress.
     */
    public void requestAbort() {
        Run current = active;
        if (current == null) {
            log.info("Abort requested with no run in progress; ignoring");
            return;
        }
        current.abort();
    }

    public RunResult run(RunPlan plan, CheckpointStore store, TrackerClient client) {
        return run(plan, store, client, "run_" + UUID.randomUUID());
    }

    public RunResult run(RunPlan plan, CheckpointStore store, TrackerClient client, String runId) {
        Run run = new Run(plan, store, new TaskDispatcher(client), runId);
        active = run;
        try {
            return run.execute();
        } finally {
            active = null;
        }
    }

    private final class Run {
        private final RunPlan plan;
        private final CheckpointStore store;
        private final TaskDispatcher dispatcher;
        private final String runId;
        private final Map<String, TaskStatus> state = new HashMap<>();
        private final Map<String, String> remoteKeys = new HashMap<>();
        private final Map<String, CheckpointRecord> records = new HashMap<>();
        private final Set<String> executed = new HashSet<>();
        private final Map<String, Deque<CreationTask>> readyByGroup = new LinkedHashMap<>();
        private final Set<String> busyGroups = new HashSet<>();
        private final AtomicInteger dispatched = new AtomicInteger();
        private RuntimeException fatal;
        private boolean interrupted;
        private volatile boolean abortRequested;

        private Run(RunPlan plan, CheckpointStore store, TaskDispatcher dispatcher, String runId) {
            this.plan = plan;
            this.store = store;
            this.dispatcher = dispatcher;
            this.runId = runId;
        }

        private void abort() {
            if (!abortRequested) {
                log.warn("Abort requested for run {}, no further tasks will be dispatched", runId);
            }
            abortRequested = true;
        }

        private RunResult execute() {
            long startedAt = clock.getAsLong();
            log.info("Run {} starting: {} task(s), {} worker(s)", runId, plan.size(), workerThreads);
            audit(RunAuditLog.AuditEvent.ofRun("run.start", runId, "ok", Map.of(
                    "tasks", plan.size(),
                    "plan_fingerprint", plan.fingerprint()
            )));
            try {
                restore();
                schedule();
            } catch (RuntimeException e) {
                audit(RunAuditLog.AuditEvent.ofRun("run.finish", runId, "error", Map.of(
                        "error", String.valueOf(e.getMessage())
                )));
                throw e;
            }
            return finish(startedAt);
        }

        private void restore() {
            Map<String, CheckpointRecord> existing = store.load();
            List<CreationTask> failedEarlier = new ArrayList<>();
            for (CreationTask task : plan.tasks()) {
                CheckpointRecord record = existing.get(task.id());
                TaskStatus status = record == null ? TaskStatus.PENDING : record.status();
                if (record != null) {
                    records.put(task.id(), record);
                }
                if (status == TaskStatus.DONE) {
                    state.put(task.id(), TaskStatus.DONE);
                    if (record.remoteKey() != null) {
                        remoteKeys.put(task.id(), record.remoteKey());
                    }
                } else if (status == TaskStatus.FAILED) {
                    state.put(task.id(), TaskStatus.FAILED);
                    failedEarlier.add(task);
                } else {
                    state.put(task.id(), TaskStatus.PENDING);
                }
            }
            int satisfied = (int) state.values().stream().filter(s -> s == TaskStatus.DONE).count();
            if (satisfied > 0 || !failedEarlier.isEmpty()) {
                log.info("Run {} resuming: {} task(s) already done, {} failed earlier", runId, satisfied, failedEarlier.size());
            }
            for (CreationTask task : failedEarlier) {
                skipDependents(task, records.get(task.id()).error());
            }
            for (CreationTask task : plan.tasks()) {
                if (isReady(task)) {
                    enqueue(task);
                }
            }
        }

        private void schedule() {
            ThreadPoolExecutor pool = new ThreadPoolExecutor(
                    workerThreads,
                    workerThreads,
                    30L,
                    TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(),
                    workerThreadFactory()
            );
            ExecutorCompletionService<Completion> completions = new ExecutorCompletionService<>(pool);
            int inFlight = 0;
            try {
                while (true) {
                    if (!abortRequested && fatal == null) {
                        inFlight += dispatchReady(completions, workerThreads - inFlight);
                    }
                    if (inFlight == 0) {
                        break;
                    }
                    Completion completion = awaitCompletion(completions);
                    inFlight--;
                    busyGroups.remove(completion.task().groupKey());
                    apply(completion);
                }
            } finally {
                pool.shutdown();
                try {
                    if (!pool.awaitTermination(30L, TimeUnit.SECONDS)) {
                        pool.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    pool.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            if (fatal != null) {
                throw fatal;
            }
        }

        private int dispatchReady(ExecutorCompletionService<Completion> completions, int capacity) {
            int submitted = 0;
            for (Map.Entry<String, Deque<CreationTask>> entry : readyByGroup.entrySet()) {
                if (submitted >= capacity) {
                    break;
                }
                String group = entry.getKey();
                Deque<CreationTask> queue = entry.getValue();
                if (queue.isEmpty() || busyGroups.contains(group)) {
                    continue;
                }
                CreationTask task = null;
                TaskDispatcher.PreparedCall call = null;
                // A task that cannot be prepared fails in place; the next one in the group is tried.
                while (call == null && !queue.isEmpty() && fatal == null) {
                    task = queue.poll();
                    try {
                        call = dispatcher.prepare(task, remoteKeys);
                    } catch (RuntimeException e) {
                        recordFailure(task, e.getMessage(), FailureKind.UNEXPECTED, attemptsOf(task));
                    }
                }
                if (call == null) {
                    continue;
                }
                CreationTask next = task;
                TaskDispatcher.PreparedCall prepared = call;
                busyGroups.add(group);
                state.put(next.id(), TaskStatus.IN_PROGRESS);
                int attempts = attemptsOf(next) + 1;
                completions.submit(() -> perform(next, prepared, attempts));
                submitted++;
            }
            return submitted;
        }

        /**
         * Worker side: checkpoint IN_PROGRESS, call the tracker, checkpoint
         * the outcome. Never throws; problems travel back in the completion.
         */
        private Completion perform(CreationTask task, TaskDispatcher.PreparedCall call, int attempts) {
            try {
                store.put(CheckpointRecord.inProgress(task.id(), attempts, runId, clock.getAsLong()));
            } catch (RuntimeException e) {
                return new Completion(task, null, null, e);
            }
            dispatched.incrementAndGet();
            CheckpointRecord outcome;
            String linkType = null;
            try {
                TaskDispatcher.CallResult result = call.call();
                linkType = result.linkType();
                outcome = CheckpointRecord.done(task.id(), result.remoteKey(), attempts, runId, clock.getAsLong());
            } catch (TrackerException e) {
                outcome = CheckpointRecord.failed(task.id(), e.getMessage(), e.failureKind(), attempts, runId, clock.getAsLong());
            } catch (RuntimeException e) {
                log.error("Task {} failed unexpectedly", task.id(), e);
                String message = e.getClass().getSimpleName() + ": " + e.getMessage();
                outcome = CheckpointRecord.failed(task.id(), message, FailureKind.UNEXPECTED, attempts, runId, clock.getAsLong());
            }
            try {
                store.put(outcome);
            } catch (RuntimeException e) {
                log.error("Task {} finished as {} but its checkpoint could not be written", task.id(), outcome.status(), e);
                return new Completion(task, outcome, linkType, e);
            }
            return new Completion(task, outcome, linkType, null);
        }

        private Completion awaitCompletion(ExecutorCompletionService<Completion> completions) {
            while (true) {
                try {
                    return completions.take().get();
                } catch (InterruptedException e) {
                    // keep draining so in-flight checkpoints land
                    abort();
                    interrupted = true;
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Worker failed outside its task boundary", e.getCause());
                }
            }
        }

        private void apply(Completion completion) {
            CreationTask task = completion.task();
            executed.add(task.id());
            if (completion.storeFailure() != null) {
                if (fatal == null) {
                    fatal = completion.storeFailure();
                }
                state.put(task.id(), TaskStatus.PENDING);
                return;
            }
            CheckpointRecord record = completion.record();
            records.put(task.id(), record);
            if (record.status() == TaskStatus.DONE) {
                state.put(task.id(), TaskStatus.DONE);
                if (record.remoteKey() != null) {
                    remoteKeys.put(task.id(), record.remoteKey());
                }
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("operation", task.operation().name());
                details.put("attempts", record.attempts());
                if (record.remoteKey() != null) {
                    details.put("remote_key", record.remoteKey());
                }
                if (completion.linkType() != null) {
                    details.put("link_type", completion.linkType());
                }
                audit(RunAuditLog.AuditEvent.ofTask("task.done", runId, task.id(), task.groupKey(), "ok", details));
                for (String dependentId : plan.dependentsOf(task.id())) {
                    plan.task(dependentId).filter(this::isReady).ifPresent(this::enqueue);
                }
            } else {
                onFailed(task, record);
            }
        }

        private void recordFailure(CreationTask task, String error, FailureKind kind, int attempts) {
            CheckpointRecord record = CheckpointRecord.failed(task.id(), error, kind, attempts, runId, clock.getAsLong());
            try {
                store.put(record);
            } catch (RuntimeException e) {
                if (fatal == null) {
                    fatal = e;
                }
                return;
            }
            executed.add(task.id());
            records.put(task.id(), record);
            onFailed(task, record);
        }

        private void onFailed(CreationTask task, CheckpointRecord record) {
            state.put(task.id(), TaskStatus.FAILED);
            log.warn("Task {} failed ({}): {}", task.id(), record.failureKind(), record.error());
            audit(RunAuditLog.AuditEvent.ofTask("task.failed", runId, task.id(), task.groupKey(), "failed", Map.of(
                    "operation", task.operation().name(),
                    "failure_kind", String.valueOf(record.failureKind()),
                    "error", String.valueOf(record.error())
            )));
            skipDependents(task, record.error());
        }

        private void skipDependents(CreationTask failed, String cause) {
            Deque<String> pending = new ArrayDeque<>(plan.dependentsOf(failed.id()));
            Set<String> seen = new HashSet<>();
            String reason = "dependency " + failed.id() + " failed" + (cause == null || cause.isBlank() ? "" : ": " + cause);
            int skipped = 0;
            while (!pending.isEmpty()) {
                String id = pending.poll();
                if (!seen.add(id)) {
                    continue;
                }
                pending.addAll(plan.dependentsOf(id));
                TaskStatus current = state.get(id);
                if (current == TaskStatus.DONE || current == TaskStatus.FAILED || current == TaskStatus.SKIPPED) {
                    continue;
                }
                CheckpointRecord previous = records.get(id);
                CheckpointRecord record = CheckpointRecord.skipped(id, reason, previous == null ? 0 : previous.attempts(), runId, clock.getAsLong());
                state.put(id, TaskStatus.SKIPPED);
                records.put(id, record);
                if (previous == null || previous.status() != TaskStatus.SKIPPED || !reason.equals(previous.error())) {
                    try {
                        store.put(record);
                    } catch (RuntimeException e) {
                        if (fatal == null) {
                            fatal = e;
                        }
                    }
                }
                skipped++;
            }
            if (skipped > 0) {
                log.warn("Skipped {} task(s) depending on {}", skipped, failed.id());
                audit(RunAuditLog.AuditEvent.ofTask("task.skip_dependents", runId, failed.id(), failed.groupKey(), "skipped",
                        Map.of("skipped", skipped)));
            }
        }

        private boolean isReady(CreationTask task) {
            if (state.get(task.id()) != TaskStatus.PENDING) {
                return false;
            }
            for (String dep : task.dependsOn()) {
                if (state.get(dep) != TaskStatus.DONE) {
                    return false;
                }
            }
            return true;
        }

        private void enqueue(CreationTask task) {
            readyByGroup.computeIfAbsent(task.groupKey(), k -> new ArrayDeque<>()).add(task);
        }

        private int attemptsOf(CreationTask task) {
            CheckpointRecord record = records.get(task.id());
            return record == null ? 0 : record.attempts();
        }

        private RunResult finish(long startedAt) {
            Map<String, TaskOutcome> outcomes = new LinkedHashMap<>();
            for (CreationTask task : plan.tasks()) {
                TaskStatus status = state.getOrDefault(task.id(), TaskStatus.PENDING);
                if (status == TaskStatus.IN_PROGRESS) {
                    status = TaskStatus.PENDING;
                }
                CheckpointRecord record = records.get(task.id());
                boolean terminal = status == TaskStatus.DONE || status == TaskStatus.FAILED || status == TaskStatus.SKIPPED;
                outcomes.put(task.id(), new TaskOutcome(
                        task.id(),
                        task.groupKey(),
                        task.operation(),
                        status,
                        remoteKeys.get(task.id()),
                        terminal && record != null ? record.error() : null,
                        terminal && record != null ? record.failureKind() : null,
                        executed.contains(task.id())
                ));
            }
            boolean aborted = abortRequested;
            RunResult result = new RunResult(runId, startedAt, clock.getAsLong(), aborted, dispatched.get(), outcomes);
            log.info("Run {} {}: done={} failed={} skipped={} pending={} operations={}",
                    runId,
                    aborted ? "aborted" : "finished",
                    result.count(TaskStatus.DONE),
                    result.count(TaskStatus.FAILED),
                    result.count(TaskStatus.SKIPPED),
                    result.count(TaskStatus.PENDING),
                    result.operationsDispatched());
            audit(RunAuditLog.AuditEvent.ofRun("run.finish", runId, aborted ? "aborted" : "ok", Map.of(
                    "done", result.count(TaskStatus.DONE),
                    "failed", result.count(TaskStatus.FAILED),
                    "skipped", result.count(TaskStatus.SKIPPED),
                    "pending", result.count(TaskStatus.PENDING),
                    "operations", result.operationsDispatched()
            )));
            return result;
        }

        private void audit(RunAuditLog.AuditEvent event) {
            if (auditLog == null) {
                return;
            }
            try {
                auditLog.log(event);
            } catch (RuntimeException e) {
                log.warn("Audit write failed for {} {}: {}", event.action(), event.taskId(), e.getMessage());
            }
        }
    }

    private static ThreadFactory workerThreadFactory() {
        int pool = POOL_SEQ.incrementAndGet();
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ticketforge-worker-" + pool + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record Completion(
            CreationTask task,
            CheckpointRecord record,
            String linkType,
            RuntimeException storeFailure
    ) {
    }
}
