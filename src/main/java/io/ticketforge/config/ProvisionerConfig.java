package io.ticketforge.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one provisioning namespace. Every migration gets its
 * own namespace so checkpoints of unrelated migrations never mix.
 */
public final class ProvisionerConfig {
    public static final String DEFAULT_NAMESPACE = "default";
    public static final String DEFAULT_NAMESPACES_DIR = "namespaces";
    public static final String SETTINGS_FILE_NAME = "ticketforge-settings.json";
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_BACKOFF_MS = 1_500L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 45_000L;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_WORKER_THREADS = 4;
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 4;
    public static final int DEFAULT_REQUESTS_PER_SECOND = 10;
    public static final int DEFAULT_BURST = 10;
    public static final String DEFAULT_API_VERSION = "2";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String namespace;

    public ProvisionerConfig(Path rootDir, Path rootBaseDir, String namespace) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.namespace = namespace;
    }

    public static ProvisionerConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_NAMESPACE);
    }

    public static ProvisionerConfig fromRoot(String root, String namespace) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeNamespace = sanitizeNamespace(namespace);
        Path scoped = DEFAULT_NAMESPACE.equals(safeNamespace)
                ? base
                : base.resolve(DEFAULT_NAMESPACES_DIR).resolve(safeNamespace);
        return new ProvisionerConfig(scoped, base, safeNamespace);
    }

    static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.isBlank() || "-".equals(value)) {
            return DEFAULT_NAMESPACE;
        }
        if (value.startsWith(".")) {
            value = "ns" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String namespace() {
        return namespace;
    }

    public Path dbFile() {
        return rootDir.resolve("ticketforge.db");
    }

    public Path stateFile() {
        return rootDir.resolve("checkpoint-state.json");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path securityRoot() {
        return rootDir.resolve("security");
    }

    public Path auditSigningKeyFile() {
        return securityRoot().resolve("audit-signing.key");
    }

    public Path reportsRoot() {
        return rootDir.resolve("reports");
    }
}
