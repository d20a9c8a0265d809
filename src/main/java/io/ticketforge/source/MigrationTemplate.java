package io.ticketforge.source;

import io.ticketforge.client.TextSanitizer;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Feed and scenario sections of a migration template.
 *
 * <p>{@link #fromRows} accepts the flat tabular layout, where the feature and
 * story columns are only filled on the first row of a block and carry down.
 */
public record MigrationTemplate(TemplateSection feed, TemplateSection scenario) {
    public static final int DEFAULT_FEED_ROWS = 10;
    public static final int DEFAULT_SCENARIO_ROWS = 15;

    public static final String COL_FEATURE = "Feature";
    public static final String COL_FEATURE_DESCRIPTION = "Feature Description";
    public static final String COL_FEATURE_AC = "Feature Acceptance Criteria";
    public static final String COL_STORY = "Story";
    public static final String COL_STORY_DESCRIPTION = "Story Description";
    public static final String COL_SUB_TASK = "Sub-Task";
    public static final String COL_SUB_TASK_DESCRIPTION = "Sub-Task Description";
    public static final String COL_SUB_TASK_AC = "Sub-Task Acceptance Criteria";

    private static final List<String> CARRIED_COLUMNS = List.of(
            COL_FEATURE,
            COL_FEATURE_DESCRIPTION,
            COL_FEATURE_AC,
            COL_STORY,
            COL_STORY_DESCRIPTION
    );

    public static MigrationTemplate fromRows(List<Map<String, String>> rows) {
        return fromRows(rows, DEFAULT_FEED_ROWS, DEFAULT_SCENARIO_ROWS);
    }

    public static MigrationTemplate fromRows(List<Map<String, String>> rows, int feedRows, int scenarioRows) {
        if (feedRows < 1 || scenarioRows < 1) {
            throw new IllegalArgumentException("feedRows and scenarioRows must be positive");
        }
        List<Map<String, String>> cleaned = new ArrayList<>();
        for (Map<String, String> row : rows == null ? List.<Map<String, String>>of() : rows) {
            Map<String, String> clean = new HashMap<>();
            boolean anyValue = false;
            for (Map.Entry<String, String> cell : row.entrySet()) {
                String value = TextSanitizer.multiline(cell.getValue());
                clean.put(TextSanitizer.singleLine(cell.getKey()), value);
                anyValue |= !value.isEmpty();
            }
            if (anyValue) {
                cleaned.add(clean);
            }
        }
        int required = feedRows + scenarioRows;
        if (cleaned.size() < required) {
            throw new IllegalArgumentException(
                    "Template rows too short: required at least " + required + ", found " + cleaned.size());
        }

        Map<String, String> lastSeen = new HashMap<>();
        for (Map<String, String> row : cleaned) {
            for (String column : CARRIED_COLUMNS) {
                String value = row.getOrDefault(column, "");
                if (value.isEmpty()) {
                    row.put(column, lastSeen.getOrDefault(column, ""));
                } else {
                    lastSeen.put(column, value);
                }
            }
        }
        return new MigrationTemplate(
                section(cleaned.subList(0, feedRows)),
                section(cleaned.subList(feedRows, required))
        );
    }

    private static TemplateSection section(List<Map<String, String>> rows) {
        Map<String, String> first = rows.get(0);
        List<TemplateSubTask> subTasks = new ArrayList<>();
        for (Map<String, String> row : rows) {
            String summary = row.getOrDefault(COL_SUB_TASK, "");
            if (!summary.isEmpty()) {
                subTasks.add(new TemplateSubTask(
                        summary,
                        row.getOrDefault(COL_SUB_TASK_DESCRIPTION, ""),
                        row.getOrDefault(COL_SUB_TASK_AC, "")
                ));
            }
        }
        return new TemplateSection(
                first.getOrDefault(COL_FEATURE, ""),
                first.getOrDefault(COL_FEATURE_DESCRIPTION, ""),
                first.getOrDefault(COL_FEATURE_AC, ""),
                first.getOrDefault(COL_STORY, ""),
                first.getOrDefault(COL_STORY_DESCRIPTION, ""),
                subTasks
        );
    }
}
