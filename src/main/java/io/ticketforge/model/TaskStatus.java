package io.ticketforge.model;

public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    DONE,
    FAILED,
    SKIPPED;

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        return valueOf(raw.trim().toUpperCase(java.util.Locale.ROOT));
    }
}
