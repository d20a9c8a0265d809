package io.ticketforge.client;

import io.ticketforge.model.RecordKind;

import java.util.List;

/**
 * The three operations the provisioning engine needs from a remote tracker.
 * Implementations must be safe to call from several worker threads. Every
 * method reports failures as {@link TransientFailureException} (retries
 * exhausted) or {@link PermanentFailureException} (request rejected).
 */
public interface TrackerClient {
    /**
     * @return the remote key of the created record, never blank
     */
    String create(RecordKind kind, CreateRequest request);

    /**
     * Tries {@code typeCandidates} left to right and returns the first one
     * the tracker accepts.
     *
     * @throws LinkTypeMismatchException when every candidate was rejected
     */
    LinkResult link(String sourceKey, String targetKey, List<String> typeCandidates);

    void setField(String key, String fieldName, String value);
}
