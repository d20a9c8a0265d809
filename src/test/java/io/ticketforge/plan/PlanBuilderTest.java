package io.ticketforge.plan;

import io.ticketforge.model.ProvisioningManifest;
import io.ticketforge.model.RecordSpec;
import io.ticketforge.model.TaskOperation;
import io.ticketforge.source.TemplateFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

final class PlanBuilderTest {

    @Test
    void expectedCountsMatchFeedAndScenarioShape() {
        RunPlan plan = new PlanBuilder().buildPlan(TemplateFixtures.manifest(2, 2));

        KindCounts totals = plan.expectedTotals();
        Assertions.assertEquals(3, totals.features());
        Assertions.assertEquals(4, totals.stories());
        Assertions.assertEquals(48, totals.subTasks());
        Assertions.assertEquals(4, totals.links());
        // 1 + 9*2 feed criteria, 2 * (1 + 15) scenario criteria
        Assertions.assertEquals(51, totals.fieldUpdates());
        Assertions.assertEquals(totals.total(), plan.size());

        Assertions.assertEquals(List.of("feeds", "feed.Feed1", "feed.Feed2", "scenario.Scenario1", "scenario.Scenario2"),
                plan.groupKeys());
        Assertions.assertEquals(new KindCounts(0, 1, 9, 1, 9), plan.expectedByGroup().get("feed.Feed1"));
        Assertions.assertEquals(new KindCounts(1, 1, 15, 1, 16), plan.expectedByGroup().get("scenario.Scenario2"));
    }

    @Test
    void tasksAreTopologicallyOrderedWithDeterministicIds() {
        RunPlan first = new PlanBuilder().buildPlan(TemplateFixtures.manifest(2, 1));
        RunPlan second = new PlanBuilder().buildPlan(TemplateFixtures.manifest(2, 1));

        Assertions.assertEquals(
                first.tasks().stream().map(CreationTask::id).toList(),
                second.tasks().stream().map(CreationTask::id).toList()
        );
        Assertions.assertEquals(first.fingerprint(), second.fingerprint());

        Set<String> seen = new HashSet<>();
        for (CreationTask task : first.tasks()) {
            for (String dep : task.dependsOn()) {
                Assertions.assertTrue(seen.contains(dep), task.id() + " emitted before " + dep);
            }
            seen.add(task.id());
        }
        Assertions.assertEquals("feeds:feature:1", first.tasks().get(0).id());
    }

    @Test
    void storyLinkAndSubTaskDependenciesFollowHierarchy() {
        RunPlan plan = new PlanBuilder().buildPlan(TemplateFixtures.manifest(1, 1));

        CreationTask story = plan.task("feed.Feed1:story:1").orElseThrow();
        Assertions.assertEquals(List.of("feeds:feature:1"), story.dependsOn());

        LinkTask link = (LinkTask) plan.task("feed.Feed1:link:1").orElseThrow();
        Assertions.assertEquals(TaskOperation.LINK, link.operation());
        Assertions.assertEquals("feed.Feed1:story:1", link.sourceTaskId());
        Assertions.assertEquals("feeds:feature:1", link.targetTaskId());
        Assertions.assertEquals(List.of("Relates", "Relates to"), link.linkTypeCandidates());

        CreateTask sub = (CreateTask) plan.task("feed.Feed1:sub-task:3").orElseThrow();
        Assertions.assertEquals(List.of("feed.Feed1:story:1", "feed.Feed1:link:1"), sub.dependsOn());
        Assertions.assertEquals("feed.Feed1:story:1", sub.parentTaskId());

        SetFieldTask criteria = (SetFieldTask) plan.task("feed.Feed1:sub-task:3:acceptance-criteria").orElseThrow();
        Assertions.assertEquals(List.of("feed.Feed1:sub-task:3"), criteria.dependsOn());
        Assertions.assertEquals(PlanBuilder.ACCEPTANCE_CRITERIA_FIELD, criteria.fieldName());

        Assertions.assertTrue(plan.dependentsOf("feed.Feed1:link:1").contains("feed.Feed1:sub-task:1"));
        Assertions.assertTrue(plan.task("scenario.Scenario1:story:1:acceptance-criteria").isEmpty());
    }

    @Test
    void storyDefaultsToTheOnlyFeatureOfItsGroup() {
        ProvisioningManifest manifest = new ProvisioningManifest("P", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "", null, "EPIC-1"),
                RecordSpec.story("s", "g", "Story", "", null, null)
        ));
        RunPlan plan = new PlanBuilder().buildPlan(manifest);
        Assertions.assertEquals(List.of("g:feature:1"), plan.task("g:story:1").orElseThrow().dependsOn());
        Assertions.assertEquals(List.of("Relates"), ((LinkTask) plan.task("g:link:1").orElseThrow()).linkTypeCandidates());
    }

    @Test
    void rejectsAcceptanceCriteriaEmbeddedInDescription() {
        ProvisioningManifest copied = new ProvisioningManifest("P", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "Intro\n* Data lands in the store", "Data lands in the store", "EPIC-1")
        ));
        SpecValidationException error = Assertions.assertThrows(SpecValidationException.class,
                () -> new PlanBuilder().buildPlan(copied));
        Assertions.assertTrue(error.violations().get(0).contains("acceptance criteria"));

        ProvisioningManifest heading = new ProvisioningManifest("P", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "Intro\n*Acceptance Criteria:*\nIt works", null, "EPIC-1")
        ));
        Assertions.assertThrows(SpecValidationException.class, () -> new PlanBuilder().buildPlan(heading));
    }

    @Test
    void shortCriteriaInsideAnotherWordAreNotEmbedded() {
        ProvisioningManifest manifest = new ProvisioningManifest("P", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "Legacy job abandoned", "Done", "EPIC-1")
        ));
        RunPlan plan = new PlanBuilder().buildPlan(manifest);
        Assertions.assertTrue(plan.task("g:feature:1:acceptance-criteria").isPresent());

        ProvisioningManifest wordMatch = new ProvisioningManifest("P", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "Legacy job. Done!", "Done", "EPIC-1")
        ));
        Assertions.assertThrows(SpecValidationException.class, () -> new PlanBuilder().buildPlan(wordMatch));
    }

    @Test
    void collectsEveryViolationBeforeFailing() {
        ProvisioningManifest manifest = new ProvisioningManifest(" ", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "", null, null),
                RecordSpec.feature("f", "g", " ", "", null, "EPIC-1")
        ));
        SpecValidationException error = Assertions.assertThrows(SpecValidationException.class,
                () -> new PlanBuilder().buildPlan(manifest));
        Assertions.assertEquals(4, error.violations().size(), error.violations().toString());
    }

    @Test
    void rejectsDanglingParentAndFeatureReferences() {
        ProvisioningManifest manifest = new ProvisioningManifest("P", null, null, List.of(
                RecordSpec.feature("f", "g", "Feature", "", null, "EPIC-1"),
                RecordSpec.story("s", "g", "Story", "", null, "missing"),
                RecordSpec.subTask("t", "g", "Sub", "", null, "f")
        ));
        SpecValidationException error = Assertions.assertThrows(SpecValidationException.class,
                () -> new PlanBuilder().buildPlan(manifest));
        Assertions.assertEquals(2, error.violations().size(), error.violations().toString());
    }

    @Test
    void rejectsEmptyLinkTypeCandidates() {
        ProvisioningManifest manifest = new ProvisioningManifest("P", null, List.of(" "), List.of(
                RecordSpec.feature("f", "g", "Feature", "", null, "EPIC-1")
        ));
        Assertions.assertThrows(SpecValidationException.class, () -> new PlanBuilder().buildPlan(manifest));
    }
}
