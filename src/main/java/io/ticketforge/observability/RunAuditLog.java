package io.ticketforge.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.ticketforge.security.SensitiveDataMasker;
import io.ticketforge.util.Hashing;
import io.ticketforge.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines trail of what a run did. Each row carries the hash
 * of the previous row, so edits or deletions in the middle of the file are
 * detectable with {@link #verify()}.
 */
public final class RunAuditLog {
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private String previousHash;

    public RunAuditLog(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public Path file() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("run_id", event.runId());
        row.put("task_id", event.taskId());
        row.put("group_key", event.groupKey());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes the hash chain over the whole file.
     */
    public synchronized IntegrityResult verify() {
        List<String> problems = new ArrayList<>();
        int rows = 0;
        try {
            String expectedPrev = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                rows++;
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                String hash = String.valueOf(row.remove("hash"));
                row.remove("signature");
                String prev = String.valueOf(row.get("prev_hash"));
                if (!expectedPrev.equals(prev)) {
                    problems.add("row " + rows + ": prev_hash does not match previous row");
                }
                if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                    problems.add("row " + rows + ": hash mismatch");
                }
                expectedPrev = hash;
            }
        } catch (IOException e) {
            problems.add("unreadable audit log: " + e.getMessage());
        }
        return new IntegrityResult(problems.isEmpty(), rows, problems);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read audit log tail: " + auditFile, e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        return Jsons.mapper().convertValue(masked, LinkedHashMap.class);
    }

    public record AuditEvent(
            String action,
            String runId,
            String taskId,
            String groupKey,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent ofRun(String action, String runId, String result, Map<String, Object> details) {
            return new AuditEvent(action, runId, null, null, result, details == null ? Map.of() : details);
        }

        public static AuditEvent ofTask(String action, String runId, String taskId, String groupKey, String result,
                                        Map<String, Object> details) {
            return new AuditEvent(action, runId, taskId, groupKey, result, details == null ? Map.of() : details);
        }
    }

    public record IntegrityResult(boolean ok, int checkedRows, List<String> problems) {
    }
}
