package io.ticketforge.client;

import io.ticketforge.model.RecordKind;

import java.util.List;

/**
 * Fields of a record to create. {@code parentKey} is set for sub-tasks and
 * {@code epicKey} for features; both are null otherwise.
 */
public record CreateRequest(
        String projectKey,
        RecordKind kind,
        String summary,
        String description,
        String parentKey,
        String epicKey,
        List<String> labels
) {
    public CreateRequest {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
