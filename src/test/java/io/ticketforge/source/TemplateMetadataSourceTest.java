package io.ticketforge.source;

import io.ticketforge.model.ProvisioningManifest;
import io.ticketforge.model.RecordKind;
import io.ticketforge.model.RecordSpec;
import io.ticketforge.plan.SpecValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class TemplateMetadataSourceTest {

    @Test
    void expandsFeedsAndScenariosIntoGroups() {
        ProvisioningManifest manifest = TemplateFixtures.manifest(2, 2);

        Assertions.assertEquals("MIG", manifest.projectKey());
        Assertions.assertEquals(List.of("migration"), manifest.labels());
        Assertions.assertEquals(List.of("Relates", "Relates to"), manifest.linkTypeCandidates());
        Assertions.assertEquals(3, count(manifest, RecordKind.FEATURE));
        Assertions.assertEquals(4, count(manifest, RecordKind.STORY));
        Assertions.assertEquals(48, count(manifest, RecordKind.SUB_TASK));

        RecordSpec sharedFeature = find(manifest, TemplateMetadataSource.FEED_FEATURE_REF);
        Assertions.assertEquals(TemplateMetadataSource.FEEDS_GROUP, sharedFeature.groupKey());
        Assertions.assertEquals("Feed migration for Trade Surveillance", sharedFeature.summary());
        Assertions.assertEquals("MIG-1", sharedFeature.epicRef());
        Assertions.assertEquals("All feeds for Trade Surveillance arrive in the target store", sharedFeature.acceptanceCriteria());

        RecordSpec feedStory = find(manifest, "feed.story.Feed2");
        Assertions.assertEquals("feed.Feed2", feedStory.groupKey());
        Assertions.assertEquals("Onboard feed Feed2", feedStory.summary());
        Assertions.assertEquals(TemplateMetadataSource.FEED_FEATURE_REF, feedStory.featureRef());

        RecordSpec scenarioSub = find(manifest, "scenario.subtask.Scenario1.15");
        Assertions.assertEquals("scenario.Scenario1", scenarioSub.groupKey());
        Assertions.assertEquals("scenario.story.Scenario1", scenarioSub.parentRef());
        Assertions.assertEquals("Scenario step 15 for Scenario1", scenarioSub.summary());
        Assertions.assertEquals("Scenario step 15 is verified for Scenario1", scenarioSub.acceptanceCriteria());
    }

    @Test
    void rendersMultiLineDescriptionsAsBullets() {
        ProvisioningManifest manifest = TemplateFixtures.manifest(1, 0);
        RecordSpec story = find(manifest, "feed.story.Feed1");
        Assertions.assertEquals("* Configure connector for Feed1\n* Backfill Feed1 history", story.description());
        Assertions.assertFalse(story.description().contains("verified"));
    }

    @Test
    void appendsFeedNameWhenStoryTemplateLacksPlaceholder() {
        MigrationTemplate template = new MigrationTemplate(
                TemplateFixtures.feedSection("Onboard feed"),
                TemplateFixtures.scenarioSection()
        );
        ProvisioningManifest many = new TemplateMetadataSource(template, TemplateFixtures.metadata(2, 0)).load();
        Assertions.assertEquals("Onboard feed - Feed1", find(many, "feed.story.Feed1").summary());

        ProvisioningManifest single = new TemplateMetadataSource(template, TemplateFixtures.metadata(1, 0)).load();
        Assertions.assertEquals("Onboard feed", find(single, "feed.story.Feed1").summary());
    }

    @Test
    void noFeedsMeansNoSharedFeature() {
        ProvisioningManifest manifest = TemplateFixtures.manifest(0, 1);
        Assertions.assertTrue(manifest.records().stream().noneMatch(r -> r.ref().equals(TemplateMetadataSource.FEED_FEATURE_REF)));
        Assertions.assertEquals(1, count(manifest, RecordKind.FEATURE));
    }

    @Test
    void unnamedItemsGetPositionalNames() {
        MigrationMetadata metadata = new MigrationMetadata(
                "MIG", "MIG-1", "Surv",
                List.of(Map.of("owner", "ops")),
                List.of(),
                null, null, null
        );
        ProvisioningManifest manifest = new TemplateMetadataSource(TemplateFixtures.template(), metadata).load();
        Assertions.assertNotNull(find(manifest, "feed.story.Feed-1"));
        Assertions.assertEquals(List.of("Relates"), manifest.linkTypeCandidates());
    }

    @Test
    void missingRequiredMetadataIsReportedTogether() {
        MigrationMetadata metadata = new MigrationMetadata(" ", null, "Surv", null, null, null, null, null);
        SpecValidationException error = Assertions.assertThrows(
                SpecValidationException.class,
                () -> new TemplateMetadataSource(TemplateFixtures.template(), metadata).load()
        );
        Assertions.assertEquals(2, error.violations().size());
        Assertions.assertTrue(error.getMessage().contains("projectKey"));
        Assertions.assertTrue(error.getMessage().contains("epicKeyForFeatures"));
    }

    @Test
    void rowsLayoutCarriesFeatureAndStoryColumnsDown() {
        List<Map<String, String>> rows = new ArrayList<>();
        rows.add(row("Feeds SURVEILLANCE_NAME", "Story FEED_NAME", "Sub 1"));
        rows.add(row("", "", "Sub 2"));
        rows.add(row("", "", ""));
        rows.add(row("Scenario SCENARIO_NAME", "Story SCENARIO_NAME", "Sub A"));
        rows.add(row("", "", "Sub B"));
        rows.add(row("", "", "Sub C"));

        MigrationTemplate template = MigrationTemplate.fromRows(rows, 2, 3);

        Assertions.assertEquals("Feeds SURVEILLANCE_NAME", template.feed().feature());
        Assertions.assertEquals(2, template.feed().subTasks().size());
        Assertions.assertEquals("Scenario SCENARIO_NAME", template.scenario().feature());
        Assertions.assertEquals("Story SCENARIO_NAME", template.scenario().story());
        Assertions.assertEquals(List.of("Sub A", "Sub B", "Sub C"),
                template.scenario().subTasks().stream().map(TemplateSubTask::summary).toList());
    }

    @Test
    void defaultRowsLayoutHasTenFeedRowsAndFifteenScenarioRows() {
        List<Map<String, String>> rows = new ArrayList<>();
        rows.add(row("Feed feature", "Feed story", ""));
        for (int i = 1; i <= 9; i++) {
            rows.add(row("", "", "Feed sub " + i));
        }
        rows.add(row("Scenario feature", "Scenario story", "Scenario sub 1"));
        for (int i = 2; i <= 15; i++) {
            rows.add(row("", "", "Scenario sub " + i));
        }

        MigrationTemplate template = MigrationTemplate.fromRows(rows);

        Assertions.assertEquals("Feed feature", template.feed().feature());
        Assertions.assertEquals(9, template.feed().subTasks().size());
        Assertions.assertEquals("Scenario feature", template.scenario().feature());
        Assertions.assertEquals(15, template.scenario().subTasks().size());
        Assertions.assertEquals("Scenario sub 15", template.scenario().subTasks().get(14).summary());
    }

    @Test
    void sectionWithoutStorySummaryIsAValidationError() {
        TemplateSection feed = new TemplateSection("Feeds", "", "", null, "", List.of());
        MigrationTemplate template = new MigrationTemplate(feed, TemplateFixtures.scenarioSection());
        SpecValidationException error = Assertions.assertThrows(
                SpecValidationException.class,
                () -> new TemplateMetadataSource(template, TemplateFixtures.metadata(1, 1)).load()
        );
        Assertions.assertEquals(List.of("template feed section has no story summary"), error.violations());
    }

    @Test
    void rowsLayoutRejectsShortTemplates() {
        List<Map<String, String>> rows = List.of(row("Feature", "Story", "Sub"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MigrationTemplate.fromRows(rows));
    }

    @Test
    void readsTemplateAndMetadataFromJsonFiles() throws Exception {
        Path root = Files.createTempDirectory("ticketforge-test-source-");
        try {
            Path template = root.resolve("template.json");
            Path metadata = root.resolve("metadata.json");
            Files.writeString(template, """
                    {
                      "feed": {
                        "feature": "Feeds for SURVEILLANCE_NAME",
                        "featureDescription": "Move feeds",
                        "featureAcceptanceCriteria": "Feeds arrive",
                        "story": "Feed FEED_NAME",
                        "storyDescription": "Wire FEED_NAME",
                        "subTasks": [
                          {"summary": "Connect FEED_NAME", "description": "Open the port", "acceptanceCriteria": "Port open"}
                        ]
                      },
                      "scenario": {
                        "feature": "Scenario SCENARIO_NAME",
                        "featureDescription": "Port logic",
                        "featureAcceptanceCriteria": "",
                        "story": "Migrate SCENARIO_NAME",
                        "storyDescription": "Rebuild",
                        "subTasks": []
                      }
                    }
                    """);
            Files.writeString(metadata, """
                    {
                      "projectKey": "ABC ",
                      "epicKeyForFeatures": "ABC-7.",
                      "surveillanceName": "\\u201cMarket\\u201d Abuse",
                      "feeds": [{"feedName": "Orders", "format": "csv"}],
                      "scenarios": [{"name": "Spoofing"}],
                      "labels": ["bulk"],
                      "unknownSetting": true
                    }
                    """);

            ProvisioningManifest manifest = TemplateMetadataSource.fromJson(template, metadata).load();

            Assertions.assertEquals("ABC", manifest.projectKey());
            RecordSpec feature = find(manifest, TemplateMetadataSource.FEED_FEATURE_REF);
            Assertions.assertEquals("ABC-7", feature.epicRef());
            Assertions.assertEquals("Feeds for \"Market\" Abuse", feature.summary());
            Assertions.assertEquals("Connect Orders", find(manifest, "feed.subtask.Orders.1").summary());
            Assertions.assertNull(find(manifest, "scenario.feature.Spoofing").acceptanceCriteria());
        } finally {
            deleteRecursively(root);
        }
    }

    private static Map<String, String> row(String feature, String story, String subTask) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(MigrationTemplate.COL_FEATURE, feature);
        row.put(MigrationTemplate.COL_FEATURE_DESCRIPTION, feature.isEmpty() ? "" : "Describe " + feature);
        row.put(MigrationTemplate.COL_FEATURE_AC, "");
        row.put(MigrationTemplate.COL_STORY, story);
        row.put(MigrationTemplate.COL_STORY_DESCRIPTION, "");
        row.put(MigrationTemplate.COL_SUB_TASK, subTask);
        row.put(MigrationTemplate.COL_SUB_TASK_DESCRIPTION, "");
        row.put(MigrationTemplate.COL_SUB_TASK_AC, "");
        return row;
    }

    private static long count(ProvisioningManifest manifest, RecordKind kind) {
        return manifest.records().stream().filter(r -> r.kind() == kind).count();
    }

    private static RecordSpec find(ProvisioningManifest manifest, String ref) {
        return manifest.records().stream()
                .filter(r -> r.ref().equals(ref))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no record " + ref));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
