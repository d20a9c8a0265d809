package io.ticketforge.model;

public enum FailureKind {
    TRANSIENT,
    PERMANENT,
    LINK_TYPE_MISMATCH,
    DEPENDENCY_FAILED,
    UNEXPECTED
}
