package io.ticketforge.client;

import io.ticketforge.model.FailureKind;

import java.util.List;

public final class LinkTypeMismatchException extends TrackerException {
    private final List<String> attemptedNames;

    public LinkTypeMismatchException(String sourceKey, String targetKey, List<String> attemptedNames, Throwable lastRejection) {
        super("No link type accepted for " + sourceKey + " -> " + targetKey + ", tried " + attemptedNames, lastRejection);
        this.attemptedNames = List.copyOf(attemptedNames);
    }

    public List<String> attemptedNames() {
        return attemptedNames;
    }

    @Override
    public FailureKind failureKind() {
        return FailureKind.LINK_TYPE_MISMATCH;
    }
}
