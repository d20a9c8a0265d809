package io.ticketforge.client;

import io.ticketforge.model.FailureKind;

/**
 * A retryable failure (429, 5xx, I/O error, timeout) that was still failing
 * when the attempt ceiling was reached.
 */
public final class TransientFailureException extends TrackerException {
    private final int attempts;

    public TransientFailureException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.TRANSIENT;
    }
}
