package io.ticketforge.client;

import java.util.concurrent.Semaphore;
import java.util.function.LongSupplier;

/**
 * Process-wide budget for outbound tracker requests: a token bucket bounding
 * the request rate plus a semaphore bounding how many requests are in flight.
 * One instance is shared by every branch of a run.
 */
public final class RequestThrottle {
    private final Semaphore inFlight;
    private final int requestsPerSecond;
    private final int burst;
    private final LongSupplier nanoClock;
    private final Object bucketLock = new Object();
    private double tokens;
    private long lastRefillNanos;

    public RequestThrottle(int maxConcurrentRequests, int requestsPerSecond, int burst) {
        this(maxConcurrentRequests, requestsPerSecond, burst, System::nanoTime);
    }

    RequestThrottle(int maxConcurrentRequests, int requestsPerSecond, int burst, LongSupplier nanoClock) {
        this.inFlight = new Semaphore(Math.max(1, maxConcurrentRequests), true);
        this.requestsPerSecond = Math.max(0, requestsPerSecond);
        this.burst = Math.max(1, burst);
        this.nanoClock = nanoClock;
        this.tokens = this.burst;
        this.lastRefillNanos = nanoClock.getAsLong();
    }

    public static RequestThrottle unlimited() {
        return new RequestThrottle(Integer.MAX_VALUE, 0, 1);
    }

    /**
     * Blocks until a rate token and a concurrency slot are available. The
     * returned permit must be closed when the request completes.
     */
    public Permit acquire() throws InterruptedException {
        awaitToken();
        inFlight.acquire();
        return new Permit(inFlight);
    }

    public int availableSlots() {
        return inFlight.availablePermits();
    }

    private void awaitToken() throws InterruptedException {
        if (requestsPerSecond <= 0) {
            return;
        }
        while (true) {
            long waitNanos;
            synchronized (bucketLock) {
                refill();
                if (tokens >= 1.0d) {
                    tokens -= 1.0d;
                    return;
                }
                waitNanos = (long) Math.ceil((1.0d - tokens) * 1_000_000_000L / requestsPerSecond);
            }
            long waitMs = Math.max(1L, waitNanos / 1_000_000L);
            Thread.sleep(waitMs);
        }
    }

    private void refill() {
        long now = nanoClock.getAsLong();
        long elapsed = now - lastRefillNanos;
        if (elapsed <= 0L) {
            return;
        }
        tokens = Math.min(burst, tokens + (elapsed / 1_000_000_000.0d) * requestsPerSecond);
        lastRefillNanos = now;
    }

    public static final class Permit implements AutoCloseable {
        private final Semaphore semaphore;
        private boolean released;

        private Permit(Semaphore semaphore) {
            this.semaphore = semaphore;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                semaphore.release();
            }
        }
    }
}
