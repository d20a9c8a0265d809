package io.ticketforge.source;

import java.util.List;
import java.util.Map;

/**
 * User-supplied migration settings. Feed and scenario entries are free-form
 * objects; only their {@code name} (or {@code feedName} / {@code scenarioName})
 * is read.
 */
public record MigrationMetadata(
        String projectKey,
        String epicKeyForFeatures,
        String surveillanceName,
        List<Map<String, Object>> feeds,
        List<Map<String, Object>> scenarios,
        List<String> labels,
        String linkType,
        List<String> linkTypeCandidates
) {
    public MigrationMetadata {
        feeds = feeds == null ? List.of() : List.copyOf(feeds);
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
        labels = labels == null ? List.of() : List.copyOf(labels);
        linkTypeCandidates = linkTypeCandidates == null ? List.of() : List.copyOf(linkTypeCandidates);
    }
}
