package io.ticketforge.client;

import io.ticketforge.model.FailureKind;

/**
 * The tracker rejected the request (4xx other than 429, or an unusable
 * response). Never retried.
 */
public final class PermanentFailureException extends TrackerException {
    private final int statusCode;

    public PermanentFailureException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public PermanentFailureException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.PERMANENT;
    }
}
