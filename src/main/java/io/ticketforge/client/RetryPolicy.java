package io.ticketforge.client;

import java.util.concurrent.ThreadLocalRandom;

public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs) {
    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        baseBackoffMs = Math.max(0L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
    }

    /**
     * Exponential backoff after the given failed attempt (1-based), capped at
     * {@code maxBackoffMs}, with up to 250 ms of jitter.
     */
    public long computeBackoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        if (backoff == 0L) {
            return 0L;
        }
        long jitter = ThreadLocalRandom.current().nextLong(0L, 251L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
