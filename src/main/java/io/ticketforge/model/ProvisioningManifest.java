package io.ticketforge.model;

import java.util.List;

public record ProvisioningManifest(
        String projectKey,
        List<String> labels,
        List<String> linkTypeCandidates,
        List<RecordSpec> records
) {
    public static final String DEFAULT_LINK_TYPE = "Relates";

    public ProvisioningManifest {
        labels = labels == null ? List.of() : List.copyOf(labels);
        linkTypeCandidates = linkTypeCandidates == null || linkTypeCandidates.isEmpty()
                ? List.of(DEFAULT_LINK_TYPE)
                : List.copyOf(linkTypeCandidates);
        records = records == null ? List.of() : List.copyOf(records);
    }
}
