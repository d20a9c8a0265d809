package io.ticketforge.runtime;

import io.ticketforge.client.JiraTrackerClient;
import io.ticketforge.client.RemoteCallExecutor;
import io.ticketforge.client.RequestThrottle;
import io.ticketforge.client.RetryPolicy;
import io.ticketforge.client.TrackerClient;
import io.ticketforge.client.TrackerCredentials;
import io.ticketforge.config.ProvisionerConfig;
import io.ticketforge.config.ProvisionerSettings;
import io.ticketforge.engine.ProvisioningEngine;
import io.ticketforge.engine.RunResult;
import io.ticketforge.model.CheckpointRecord;
import io.ticketforge.model.TaskStatus;
import io.ticketforge.observability.RunAuditLog;
import io.ticketforge.plan.PlanBuilder;
import io.ticketforge.plan.RunPlan;
import io.ticketforge.reconcile.PlanPreview;
import io.ticketforge.reconcile.ReconciliationReport;
import io.ticketforge.reconcile.Reconciler;
import io.ticketforge.source.MetadataSource;
import io.ticketforge.storage.CheckpointStore;
import io.ticketforge.storage.Database;
import io.ticketforge.storage.RunHistoryStore;
import io.ticketforge.storage.SqliteCheckpointStore;
import io.ticketforge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for driving a provisioning run. Owns the namespace's database,
 * checkpoint store, run history and audit log, and the request throttle
 * shared by every tracker client it creates.
 *
 * <p>One run at a time per instance; {@link #abort()} may be called from any
 * thread while {@link #run} is in progress.
 */
public final class Provisioner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Provisioner.class);

    private final ProvisionerConfig config;
    private final Database database;
    private final CheckpointStore checkpointStore;
    private final RunHistoryStore runHistory;
    private final PlanBuilder planBuilder;
    private final Reconciler reconciler;
    private final AtomicBoolean running;
    private volatile ProvisionerSettings settings;
    private volatile RequestThrottle throttle;
    private volatile RunAuditLog auditLog;
    private volatile ProvisioningEngine engine;

    public Provisioner(ProvisionerConfig config) {
        this.config = config;
        this.database = new Database(config);
        this.checkpointStore = new SqliteCheckpointStore(database);
        this.runHistory = new RunHistoryStore(database);
        this.planBuilder = new PlanBuilder();
        this.reconciler = new Reconciler();
        this.running = new AtomicBoolean(false);
        this.settings = ProvisionerSettings.defaults();
    }

    public Provisioner(ProvisionerConfig config, CheckpointStore checkpointStore) {
        this.config = config;
        this.database = new Database(config);
        this.checkpointStore = checkpointStore;
        this.runHistory = new RunHistoryStore(database);
        this.planBuilder = new PlanBuilder();
        this.reconciler = new Reconciler();
        this.running = new AtomicBoolean(false);
        this.settings = ProvisionerSettings.defaults();
    }

    /**
     * Creates the namespace layout and schema and loads settings. Safe to call
     * repeatedly.
     */
    public void init() {
        database.init();
        try {
            Files.createDirectories(config.reportsRoot());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create reports directory: " + config.reportsRoot(), e);
        }
        ProvisionerSettings loaded = ProvisionerSettings.load(config.settingsFile());
        this.settings = loaded;
        this.throttle = new RequestThrottle(
                loaded.maxConcurrentRequests(),
                loaded.requestsPerSecond(),
                loaded.burst()
        );
        this.auditLog = new RunAuditLog(
                config.auditFile(),
                config.namespace(),
                loadOrCreateAuditSigningSecret(config.auditSigningKeyFile())
        );
        this.engine = new ProvisioningEngine(loaded.workerThreads(), auditLog);
        log.info("Initialized namespace {} at {}", config.namespace(), config.rootDir());
    }

    public ProvisionerConfig config() {
        return config;
    }

    public ProvisionerSettings settings() {
        return settings;
    }

    public RunAuditLog auditLog() {
        return requireInitialized().auditLog;
    }

    public RunPlan plan(MetadataSource source) {
        return planBuilder.buildPlan(source.load());
    }

    /**
     * Dry run: builds and validates the plan and reports what a full run would
     * create. Touches neither the tracker nor the checkpoint.
     */
    public PlanPreview preview(MetadataSource source) {
        PlanPreview preview = reconciler.preview(plan(source));
        log.info("Preview for {}: {} task(s), expected {}", preview.projectKey(), preview.taskCount(), preview.expectedTotals());
        return preview;
    }

    public RunResult run(MetadataSource source, TrackerClient client) {
        requireInitialized();
        RunPlan plan = plan(source);
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A run is already in progress for namespace " + config.namespace());
        }
        String runId = "run_" + UUID.randomUUID();
        try {
            warnOnPlanChange(plan);
            runHistory.recordStarted(runId, plan.fingerprint(), plan.size(), System.currentTimeMillis());
            RunResult result;
            try {
                result = engine.run(plan, checkpointStore, client, runId);
            } catch (RuntimeException e) {
                recordFinishedQuietly(runId, e);
                throw e;
            }
            runHistory.recordFinished(
                    runId,
                    runStatus(result),
                    result.count(TaskStatus.DONE),
                    result.count(TaskStatus.FAILED),
                    result.count(TaskStatus.SKIPPED),
                    result.operationsDispatched(),
                    result.finishedAtMs()
            );
            return result;
        } finally {
            running.set(false);
        }
    }

    /**
     * Reconciles the plan against the checkpoint and writes the report as JSON
     * under the namespace's reports directory.
     */
    public ReconciliationReport report(MetadataSource source) {
        requireInitialized();
        RunPlan plan = plan(source);
        ReconciliationReport report = reconciler.reconcile(plan, checkpointStore.load());
        Path file = config.reportsRoot().resolve("reconciliation-" + report.generatedAtMs() + ".json");
        try {
            Files.writeString(file, Jsons.toJson(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write reconciliation report: " + file, e);
        }
        if (!report.balanced()) {
            log.warn("Reconciliation for {} is unbalanced: missing {}, {} failed, {} skipped, {} pending",
                    report.projectKey(),
                    report.missingTotals(),
                    report.failed().size(),
                    report.skipped().size(),
                    report.pending().size());
        }
        return report;
    }

    /**
     * Operator remediation: forgets a task's checkpoint entry so the next run
     * attempts it again (along with any dependents it caused to be skipped).
     */
    public boolean clearCheckpoint(String taskId) {
        requireInitialized();
        Optional<CheckpointRecord> existing = checkpointStore.get(taskId);
        if (existing.isPresent() && existing.get().status() == TaskStatus.DONE) {
            throw new IllegalArgumentException("Refusing to clear DONE task " + taskId + "; its remote record already exists");
        }
        boolean cleared = checkpointStore.clear(taskId);
        if (cleared) {
            log.info("Cleared checkpoint entry {}", taskId);
            auditLog.log(RunAuditLog.AuditEvent.ofTask("checkpoint.clear", null, taskId, null, "ok",
                    Map.of("previous_status", existing.map(r -> r.status().name()).orElse("UNKNOWN"))));
        }
        return cleared;
    }

    public void abort() {
        ProvisioningEngine current = engine;
        if (current != null) {
            current.requestAbort();
        }
    }

    public Map<String, CheckpointRecord> checkpoint() {
        return checkpointStore.load();
    }

    public List<RunHistoryStore.RunRow> runHistory(int limit) {
        return runHistory.list(limit);
    }

    public TrackerClient createTrackerClient(TrackerCredentials credentials) {
        return createTrackerClient(settings.trackerBaseUrl(), credentials);
    }

    public TrackerClient createTrackerClient(String baseUrl, TrackerCredentials credentials) {
        requireInitialized();
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("trackerBaseUrl is not configured");
        }
        ProvisionerSettings s = settings;
        RemoteCallExecutor executor = new RemoteCallExecutor(
                new RetryPolicy(s.maxAttempts(), s.baseBackoffMs(), s.maxBackoffMs()),
                throttle
        );
        return new JiraTrackerClient(
                baseUrl,
                s.apiVersion(),
                credentials,
                executor,
                Duration.ofMillis(s.requestTimeoutMs()),
                Duration.ofMillis(s.connectTimeoutMs())
        );
    }

    @Override
    public void close() {
        checkpointStore.close();
    }

    private void warnOnPlanChange(RunPlan plan) {
        runHistory.latest().ifPresent(previous -> {
            if (previous.planFingerprint() != null && !previous.planFingerprint().equals(plan.fingerprint())) {
                log.warn("Plan fingerprint changed since run {} ({} -> {}); checkpoint entries are matched by task id",
                        previous.runId(), previous.planFingerprint(), plan.fingerprint());
            }
        });
    }

    private void recordFinishedQuietly(String runId, RuntimeException cause) {
        try {
            runHistory.recordFinished(runId, "ERROR", 0, 0, 0, 0, System.currentTimeMillis());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    private static String runStatus(RunResult result) {
        if (result.aborted()) {
            return "ABORTED";
        }
        return result.complete() ? "COMPLETED" : "PARTIAL";
    }

    private Provisioner requireInitialized() {
        if (engine == null) {
            throw new IllegalStateException("Provisioner not initialized; call init() first");
        }
        return this;
    }

    private static String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }
}
