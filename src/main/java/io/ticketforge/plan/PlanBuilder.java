package io.ticketforge.plan;

import io.ticketforge.model.ProvisioningManifest;
import io.ticketforge.model.RecordKind;
import io.ticketforge.model.RecordSpec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.regex.Pattern;

/**
 * Expands a {@link ProvisioningManifest} into a {@link RunPlan}.
 *
 * <p>Per record: a feature gets a create task; a story gets a create task
 * depending on its feature's create and a story-to-feature link task
 * depending on both; a sub-task gets a create task depending on its story's
 * create and on that story's link, so no sub-task is attempted before its
 * parent is linked. Records with acceptance criteria get a separate
 * set-field task after their create.
 *
 * <p>The builder is pure: the same manifest always produces the same task ids
 * in the same order.
 */
public final class PlanBuilder {
    public static final String ACCEPTANCE_CRITERIA_FIELD = "Acceptance criteria";
    static final String ACCEPTANCE_CRITERIA_SUFFIX = ":acceptance-criteria";

    private static final Pattern AC_HEADING = Pattern.compile(
            "^[\\s*#>\\-]*acceptance\\s+criteria\\s*(?::|$)",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE
    );

    public RunPlan buildPlan(ProvisioningManifest manifest) {
        if (manifest == null) {
            throw new SpecValidationException(List.of("manifest is required"));
        }
        Map<String, RecordSpec> byRef = validate(manifest);

        Map<String, Integer> sequences = new HashMap<>();
        Map<String, String> createIdByRef = new HashMap<>();
        for (RecordSpec record : manifest.records()) {
            String seqKey = record.groupKey() + "|" + record.kind().code();
            int seq = sequences.merge(seqKey, 1, Integer::sum);
            createIdByRef.put(record.ref(), record.groupKey() + ":" + record.kind().code() + ":" + seq);
        }

        List<CreationTask> emitted = new ArrayList<>();
        Map<String, String> linkIdByStoryRef = new HashMap<>();
        Map<String, Integer> linkSequences = new HashMap<>();
        Map<String, KindCounts> expected = new LinkedHashMap<>();

        for (RecordSpec record : manifest.records()) {
            expected.putIfAbsent(record.groupKey(), KindCounts.ZERO);
            if (record.kind() == RecordKind.STORY) {
                int seq = linkSequences.merge(record.groupKey(), 1, Integer::sum);
                linkIdByStoryRef.put(record.ref(), record.groupKey() + ":link:" + seq);
            }
        }

        for (RecordSpec record : manifest.records()) {
            String createId = createIdByRef.get(record.ref());
            String group = record.groupKey();
            switch (record.kind()) {
                case FEATURE -> emitted.add(new CreateTask(
                        createId, group, List.of(), record, null, manifest.projectKey(), manifest.labels()));
                case STORY -> {
                    String featureCreateId = createIdByRef.get(resolveFeatureRef(record, manifest.records()));
                    emitted.add(new CreateTask(
                            createId, group, List.of(featureCreateId), record, null, manifest.projectKey(), manifest.labels()));
                    emitted.add(new LinkTask(
                            linkIdByStoryRef.get(record.ref()),
                            group,
                            List.of(createId, featureCreateId),
                            createId,
                            featureCreateId,
                            manifest.linkTypeCandidates()
                    ));
                    expected.merge(group, KindCounts.ZERO.withLink(), KindCounts::plus);
                }
                case SUB_TASK -> {
                    RecordSpec story = byRef.get(record.parentRef());
                    String storyCreateId = createIdByRef.get(story.ref());
                    emitted.add(new CreateTask(
                            createId,
                            group,
                            List.of(storyCreateId, linkIdByStoryRef.get(story.ref())),
                            record,
                            storyCreateId,
                            manifest.projectKey(),
                            manifest.labels()
                    ));
                }
            }
            expected.merge(group, KindCounts.ZERO.withCreate(record.kind()), KindCounts::plus);
            if (record.hasAcceptanceCriteria()) {
                emitted.add(new SetFieldTask(
                        createId + ACCEPTANCE_CRITERIA_SUFFIX,
                        group,
                        List.of(createId),
                        createId,
                        ACCEPTANCE_CRITERIA_FIELD,
                        record.acceptanceCriteria()
                ));
                expected.merge(group, KindCounts.ZERO.withFieldUpdate(), KindCounts::plus);
            }
        }
        return new RunPlan(manifest.projectKey(), dependencyOrder(emitted), expected);
    }

    private Map<String, RecordSpec> validate(ProvisioningManifest manifest) {
        List<String> violations = new ArrayList<>();
        if (isBlank(manifest.projectKey())) {
            violations.add("projectKey is required");
        }
        if (manifest.linkTypeCandidates().stream().allMatch(PlanBuilder::isBlank)) {
            violations.add("at least one link type candidate is required");
        }
        Map<String, RecordSpec> byRef = new LinkedHashMap<>();
        for (int i = 0; i < manifest.records().size(); i++) {
            RecordSpec record = manifest.records().get(i);
            String where = "record[" + i + "]";
            if (record == null) {
                violations.add(where + " is null");
                continue;
            }
            if (isBlank(record.ref())) {
                violations.add(where + " has no ref");
                continue;
            }
            where = where + " '" + record.ref() + "'";
            if (byRef.putIfAbsent(record.ref(), record) != null) {
                violations.add(where + " duplicates an earlier ref");
            }
            if (record.kind() == null) {
                violations.add(where + " has no kind");
            }
            if (isBlank(record.groupKey())) {
                violations.add(where + " has no groupKey");
            }
            if (isBlank(record.summary())) {
                violations.add(where + " has a blank summary");
            }
            if (record.kind() == RecordKind.FEATURE && isBlank(record.epicRef())) {
                violations.add(where + " is a feature without an epic reference");
            }
            if (mixesAcceptanceCriteria(record)) {
                violations.add(where + " embeds acceptance criteria in its description");
            }
        }
        if (violations.isEmpty()) {
            for (RecordSpec record : manifest.records()) {
                String where = "record '" + record.ref() + "'";
                if (record.kind() == RecordKind.STORY) {
                    String featureRef = resolveFeatureRef(record, manifest.records());
                    RecordSpec feature = featureRef == null ? null : byRef.get(featureRef);
                    if (feature == null || feature.kind() != RecordKind.FEATURE) {
                        violations.add(where + " does not reference a feature");
                    }
                } else if (record.kind() == RecordKind.SUB_TASK) {
                    RecordSpec parent = isBlank(record.parentRef()) ? null : byRef.get(record.parentRef());
                    if (parent == null || parent.kind() != RecordKind.STORY) {
                        violations.add(where + " does not reference a parent story");
                    }
                }
            }
        }
        if (!violations.isEmpty()) {
            throw new SpecValidationException(violations);
        }
        return byRef;
    }

    /**
     * True when the description carries acceptance criteria: either the
     * record's own criteria text or an "Acceptance Criteria" heading line.
     */
    public static boolean mixesAcceptanceCriteria(RecordSpec record) {
        String description = record.description();
        if (isBlank(description)) {
            return false;
        }
        if (AC_HEADING.matcher(description).find()) {
            return true;
        }
        if (!record.hasAcceptanceCriteria()) {
            return false;
        }
        String criteria = normalizeForComparison(record.acceptanceCriteria());
        // Whole words only: short criteria such as "Done" must not match inside "abandoned".
        return !criteria.isEmpty()
                && (" " + normalizeForComparison(description) + " ").contains(" " + criteria + " ");
    }

    private static String normalizeForComparison(String text) {
        StringBuilder sb = new StringBuilder();
        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            while (trimmed.startsWith("*") || trimmed.startsWith("-")) {
                trimmed = trimmed.substring(1).strip();
            }
            if (!trimmed.isEmpty()) {
                sb.append(trimmed).append(' ');
            }
        }
        return sb.toString().replaceAll("[^\\p{L}\\p{N}]+", " ").trim().toLowerCase(Locale.ROOT);
    }

    private static String resolveFeatureRef(RecordSpec story, List<RecordSpec> records) {
        if (!isBlank(story.featureRef())) {
            return story.featureRef();
        }
        String found = null;
        for (RecordSpec candidate : records) {
            if (candidate.kind() == RecordKind.FEATURE && story.groupKey().equals(candidate.groupKey())) {
                if (found != null) {
                    return null;
                }
                found = candidate.ref();
            }
        }
        return found;
    }

    /**
     * Stable topological order: among ready tasks the one earliest in the
     * manifest goes first, so an already ordered manifest is kept as is.
     */
    private static List<CreationTask> dependencyOrder(List<CreationTask> tasks) {
        Map<String, Integer> position = new HashMap<>();
        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<CreationTask>> waiting = new HashMap<>();
        for (int i = 0; i < tasks.size(); i++) {
            CreationTask task = tasks.get(i);
            position.put(task.id(), i);
            remaining.put(task.id(), task.dependsOn().size());
            for (String dep : task.dependsOn()) {
                waiting.computeIfAbsent(dep, k -> new ArrayList<>()).add(task);
            }
        }
        PriorityQueue<CreationTask> ready = new PriorityQueue<>(Comparator.comparingInt(t -> position.get(t.id())));
        for (CreationTask task : tasks) {
            if (task.dependsOn().isEmpty()) {
                ready.add(task);
            }
        }
        List<CreationTask> ordered = new ArrayList<>(tasks.size());
        while (!ready.isEmpty()) {
            CreationTask next = ready.poll();
            ordered.add(next);
            for (CreationTask dependent : waiting.getOrDefault(next.id(), List.of())) {
                if (remaining.merge(dependent.id(), -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (ordered.size() != tasks.size()) {
            throw new IllegalStateException("Plan has unresolvable task dependencies");
        }
        return ordered;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
