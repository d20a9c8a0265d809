package io.ticketforge.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

/**
 * Runs one tracker operation with bounded retries. Each attempt holds a
 * {@link RequestThrottle} permit only while the request is in flight; the
 * backoff sleep happens after the permit is returned so a retrying branch
 * does not block the others.
 */
public final class RemoteCallExecutor {
    private static final Logger log = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final RetryPolicy retryPolicy;
    private final RequestThrottle throttle;
    private final Sleeper sleeper;

    public RemoteCallExecutor(RetryPolicy retryPolicy, RequestThrottle throttle) {
        this(retryPolicy, throttle, Thread::sleep);
    }

    public RemoteCallExecutor(RetryPolicy retryPolicy, RequestThrottle throttle, Sleeper sleeper) {
        this.retryPolicy = retryPolicy;
        this.throttle = throttle;
        this.sleeper = sleeper;
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    public <T> T execute(String operation, RemoteCall<T> call) {
        Exception last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            long retryAfterMs = 0L;
            try (RequestThrottle.Permit ignored = throttle.acquire()) {
                return call.attempt();
            } catch (RemoteStatusException e) {
                if (!e.isTransient()) {
                    throw new PermanentFailureException(operation + " rejected: " + e.getMessage(), e.statusCode(), e);
                }
                last = e;
                retryAfterMs = e.retryAfterMs();
            } catch (IOException e) {
                last = e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientFailureException(operation + " interrupted", attempt, e);
            }
            if (attempt >= retryPolicy.maxAttempts()) {
                break;
            }
            long backoffMs = Math.max(retryPolicy.computeBackoffMs(attempt), Math.min(retryAfterMs, retryPolicy.maxBackoffMs()));
            log.warn("{} attempt {}/{} failed ({}), retrying in {} ms",
                    operation, attempt, retryPolicy.maxAttempts(), describe(last), backoffMs);
            try {
                sleeper.sleep(backoffMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientFailureException(operation + " interrupted during backoff", attempt, e);
            }
        }
        throw new TransientFailureException(
                operation + " failed after " + retryPolicy.maxAttempts() + " attempt(s): " + describe(last),
                retryPolicy.maxAttempts(),
                last
        );
    }

    private static String describe(Exception e) {
        if (e == null) {
            return "unknown error";
        }
        if (e instanceof HttpTimeoutException) {
            return "timeout: " + e.getMessage();
        }
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    @FunctionalInterface
    public interface RemoteCall<T> {
        T attempt() throws IOException, InterruptedException;
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
