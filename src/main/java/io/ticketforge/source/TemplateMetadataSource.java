package io.ticketforge.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.ticketforge.client.TextSanitizer;
import io.ticketforge.model.ProvisioningManifest;
import io.ticketforge.model.RecordSpec;
import io.ticketforge.plan.SpecValidationException;
import io.ticketforge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Expands a {@link MigrationTemplate} with {@link MigrationMetadata} into a
 * manifest of feature, story and sub-task records.
 *
 * <p>All feeds share one feature (group {@code feeds}); each feed gets its own
 * group with a story linked to that shared feature plus the feed sub-tasks.
 * Each scenario gets its own group with a feature, a story and the scenario
 * sub-tasks. Placeholders {@code SURVEILLANCE_NAME}, {@code SCENARIO_NAME} and
 * {@code FEED_NAME} are substituted in every text.
 */
public final class TemplateMetadataSource implements MetadataSource {
    private static final Logger log = LoggerFactory.getLogger(TemplateMetadataSource.class);

    public static final String FEEDS_GROUP = "feeds";
    public static final String FEED_FEATURE_REF = "feed.feature";

    private static final String PH_SURVEILLANCE = "SURVEILLANCE_NAME";
    private static final String PH_SCENARIO = "SCENARIO_NAME";
    private static final String PH_FEED = "FEED_NAME";

    private final MigrationTemplate template;
    private final MigrationMetadata metadata;

    public TemplateMetadataSource(MigrationTemplate template, MigrationMetadata metadata) {
        this.template = template;
        this.metadata = metadata;
    }

    /**
     * Reads the template and metadata from JSON files. The template file holds
     * either {@code feed} and {@code scenario} sections or a flat {@code rows}
     * array (optionally with {@code feedRows} and {@code scenarioRows}).
     */
    public static TemplateMetadataSource fromJson(Path templateFile, Path metadataFile) {
        return new TemplateMetadataSource(readTemplate(templateFile), readMetadata(metadataFile));
    }

    static MigrationTemplate readTemplate(Path templateFile) {
        try {
            JsonNode root = Jsons.mapper().readTree(Files.readString(templateFile));
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Template must be a JSON object: " + templateFile);
            }
            if (root.has("rows")) {
                List<Map<String, String>> rows = Jsons.mapper().convertValue(
                        root.get("rows"),
                        new TypeReference<List<Map<String, String>>>() {
                        }
                );
                int feedRows = root.path("feedRows").asInt(MigrationTemplate.DEFAULT_FEED_ROWS);
                int scenarioRows = root.path("scenarioRows").asInt(MigrationTemplate.DEFAULT_SCENARIO_ROWS);
                return MigrationTemplate.fromRows(rows, feedRows, scenarioRows);
            }
            return Jsons.mapper().treeToValue(root, MigrationTemplate.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read template: " + templateFile, e);
        }
    }

    static MigrationMetadata readMetadata(Path metadataFile) {
        try {
            return Jsons.mapper().readValue(Files.readString(metadataFile), MigrationMetadata.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read metadata: " + metadataFile, e);
        }
    }

    @Override
    public ProvisioningManifest load() {
        validate();
        String surveillance = TextSanitizer.singleLine(metadata.surveillanceName());
        String projectKey = TextSanitizer.key(metadata.projectKey());
        String epicKey = TextSanitizer.key(metadata.epicKeyForFeatures());
        List<RecordSpec> records = new ArrayList<>();

        List<String> feedNames = itemNames(metadata.feeds(), "feedName", "Feed-");
        if (!feedNames.isEmpty()) {
            TemplateSection feed = template.feed();
            records.add(RecordSpec.feature(
                    FEED_FEATURE_REF,
                    FEEDS_GROUP,
                    render(feed.feature(), surveillance, "", ""),
                    TextSanitizer.bullets(render(feed.featureDescription(), surveillance, "", "")),
                    optional(render(feed.featureAcceptanceCriteria(), surveillance, "", "")),
                    epicKey
            ));
            for (String feedName : feedNames) {
                String group = "feed." + feedName;
                String storyRef = "feed.story." + feedName;
                String summary = render(feed.story(), surveillance, "", feedName);
                if (feed.story() != null && !feed.story().contains(PH_FEED) && feedNames.size() > 1) {
                    summary = summary + " - " + feedName;
                }
                records.add(RecordSpec.story(
                        storyRef,
                        group,
                        summary,
                        TextSanitizer.bullets(render(feed.storyDescription(), surveillance, "", feedName)),
                        null,
                        FEED_FEATURE_REF
                ));
                addSubTasks(records, feed, group, "feed.subtask." + feedName, storyRef, surveillance, "", feedName);
            }
        }

        List<String> scenarioNames = itemNames(metadata.scenarios(), "scenarioName", "Scenario-");
        TemplateSection scenario = template.scenario();
        for (String scenarioName : scenarioNames) {
            String group = "scenario." + scenarioName;
            String featureRef = "scenario.feature." + scenarioName;
            String storyRef = "scenario.story." + scenarioName;
            records.add(RecordSpec.feature(
                    featureRef,
                    group,
                    render(scenario.feature(), surveillance, scenarioName, ""),
                    TextSanitizer.bullets(render(scenario.featureDescription(), surveillance, scenarioName, "")),
                    optional(render(scenario.featureAcceptanceCriteria(), surveillance, scenarioName, "")),
                    epicKey
            ));
            records.add(RecordSpec.story(
                    storyRef,
                    group,
                    render(scenario.story(), surveillance, scenarioName, ""),
                    TextSanitizer.bullets(render(scenario.storyDescription(), surveillance, scenarioName, "")),
                    null,
                    featureRef
            ));
            addSubTasks(records, scenario, group, "scenario.subtask." + scenarioName, storyRef, surveillance, scenarioName, "");
        }

        log.info("Expanded template for {}: {} feed(s), {} scenario(s), {} record(s)",
                surveillance, feedNames.size(), scenarioNames.size(), records.size());
        List<String> candidates = new ArrayList<>(metadata.linkTypeCandidates());
        if (metadata.linkType() != null && !metadata.linkType().isBlank()) {
            candidates.add(0, TextSanitizer.singleLine(metadata.linkType()));
        }
        return new ProvisioningManifest(projectKey, sanitizedLabels(), dedupe(candidates), records);
    }

    private void validate() {
        List<String> violations = new ArrayList<>();
        if (template == null) {
            violations.add("template is required");
        }
        if (metadata == null) {
            violations.add("metadata is required");
        } else {
            requireField(violations, "projectKey", metadata.projectKey());
            requireField(violations, "epicKeyForFeatures", metadata.epicKeyForFeatures());
            requireField(violations, "surveillanceName", metadata.surveillanceName());
        }
        if (template != null && metadata != null) {
            if (!metadata.feeds().isEmpty()) {
                if (template.feed() == null) {
                    violations.add("template has no feed section but metadata lists feeds");
                } else {
                    requireSectionText(violations, "feed", template.feed());
                }
            }
            if (!metadata.scenarios().isEmpty()) {
                if (template.scenario() == null) {
                    violations.add("template has no scenario section but metadata lists scenarios");
                } else {
                    requireSectionText(violations, "scenario", template.scenario());
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new SpecValidationException(violations);
        }
    }

    private static void requireSectionText(List<String> violations, String section, TemplateSection values) {
        if (values.feature() == null || TextSanitizer.singleLine(values.feature()).isEmpty()) {
            violations.add("template " + section + " section has no feature summary");
        }
        if (values.story() == null || TextSanitizer.singleLine(values.story()).isEmpty()) {
            violations.add("template " + section + " section has no story summary");
        }
    }

    private static void requireField(List<String> violations, String name, String value) {
        if (value == null || TextSanitizer.singleLine(value).isEmpty()) {
            violations.add("metadata missing required field: " + name);
        }
    }

    private static void addSubTasks(List<RecordSpec> records, TemplateSection section, String group, String refPrefix,
                                    String storyRef, String surveillance, String scenarioName, String feedName) {
        int index = 0;
        for (TemplateSubTask subTask : section.subTasks()) {
            index++;
            records.add(RecordSpec.subTask(
                    refPrefix + "." + index,
                    group,
                    render(subTask.summary(), surveillance, scenarioName, feedName),
                    TextSanitizer.bullets(render(subTask.description(), surveillance, scenarioName, feedName)),
                    optional(render(subTask.acceptanceCriteria(), surveillance, scenarioName, feedName)),
                    storyRef
            ));
        }
    }

    private static List<String> itemNames(List<Map<String, Object>> items, String alternateKey, String fallbackPrefix) {
        List<String> names = new ArrayList<>();
        int index = 0;
        for (Map<String, Object> item : items) {
            index++;
            String name = firstNonBlank(item, "name", alternateKey);
            names.add(name == null ? fallbackPrefix + index : name);
        }
        return names;
    }

    private static String firstNonBlank(Map<String, Object> item, String... keys) {
        if (item == null) {
            return null;
        }
        for (String key : keys) {
            Object value = item.get(key);
            if (value != null) {
                String text = TextSanitizer.singleLine(String.valueOf(value));
                if (!text.isEmpty()) {
                    return text;
                }
            }
        }
        return null;
    }

    static String render(String text, String surveillance, String scenarioName, String feedName) {
        if (text == null) {
            return "";
        }
        String out = text
                .replace(PH_SURVEILLANCE, surveillance)
                .replace(PH_SCENARIO, scenarioName)
                .replace(PH_FEED, feedName);
        return TextSanitizer.multiline(out);
    }

    private static String optional(String text) {
        return text == null || text.isBlank() ? null : text;
    }

    private List<String> sanitizedLabels() {
        List<String> labels = new ArrayList<>();
        for (String label : metadata.labels()) {
            String clean = TextSanitizer.key(label);
            if (!clean.isEmpty()) {
                labels.add(clean);
            }
        }
        return labels;
    }

    private static List<String> dedupe(List<String> candidates) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> out = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank() && seen.add(candidate.toLowerCase(Locale.ROOT))) {
                out.add(candidate);
            }
        }
        return out;
    }
}
