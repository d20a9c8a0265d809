package io.ticketforge.client;

import io.ticketforge.model.FailureKind;

/**
 * Base of every failure a {@link TrackerClient} reports.
 */
public abstract class TrackerException extends RuntimeException {
    protected TrackerException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind failureKind();
}
