package io.ticketforge.config;

import io.ticketforge.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code ticketforge-settings.json}. Missing fields fall
 * back to defaults and every value is clamped to a usable minimum.
 */
public record ProvisionerSettings(
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long requestTimeoutMs,
        long connectTimeoutMs,
        int workerThreads,
        int maxConcurrentRequests,
        int requestsPerSecond,
        int burst,
        String trackerBaseUrl,
        String apiVersion
) {
    public static ProvisionerSettings defaults() {
        return new ProvisionerSettings(
                ProvisionerConfig.DEFAULT_MAX_ATTEMPTS,
                ProvisionerConfig.DEFAULT_BASE_BACKOFF_MS,
                ProvisionerConfig.DEFAULT_MAX_BACKOFF_MS,
                ProvisionerConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                ProvisionerConfig.DEFAULT_CONNECT_TIMEOUT_MS,
                ProvisionerConfig.DEFAULT_WORKER_THREADS,
                ProvisionerConfig.DEFAULT_MAX_CONCURRENT_REQUESTS,
                ProvisionerConfig.DEFAULT_REQUESTS_PER_SECOND,
                ProvisionerConfig.DEFAULT_BURST,
                "",
                ProvisionerConfig.DEFAULT_API_VERSION
        );
    }

    public static ProvisionerSettings load(Path file) {
        ProvisionerSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static ProvisionerSettings fromFile(SettingsFile file, ProvisionerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxAttempts = sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 0L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        long requestTimeout = sanitizeLong(file.requestTimeoutMs(), defaults.requestTimeoutMs(), 100L);
        long connectTimeout = sanitizeLong(file.connectTimeoutMs(), defaults.connectTimeoutMs(), 100L);
        int workerThreads = sanitizeInt(file.workerThreads(), defaults.workerThreads(), 1);
        int maxConcurrent = sanitizeInt(file.maxConcurrentRequests(), defaults.maxConcurrentRequests(), 1);
        int rps = sanitizeInt(file.requestsPerSecond(), defaults.requestsPerSecond(), 0);
        int burst = sanitizeInt(file.burst(), defaults.burst(), 1);
        String baseUrl = file.trackerBaseUrl() == null ? defaults.trackerBaseUrl() : file.trackerBaseUrl().trim();
        String apiVersion = file.apiVersion() == null || file.apiVersion().isBlank()
                ? defaults.apiVersion()
                : file.apiVersion().trim();
        return new ProvisionerSettings(
                maxAttempts,
                baseBackoff,
                maxBackoff,
                requestTimeout,
                connectTimeout,
                workerThreads,
                maxConcurrent,
                rps,
                burst,
                baseUrl,
                apiVersion
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    record SettingsFile(
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long requestTimeoutMs,
            Long connectTimeoutMs,
            Integer workerThreads,
            Integer maxConcurrentRequests,
            Integer requestsPerSecond,
            Integer burst,
            String trackerBaseUrl,
            String apiVersion
    ) {
    }
}
