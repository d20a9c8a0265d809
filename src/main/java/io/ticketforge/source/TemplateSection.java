package io.ticketforge.source;

import java.util.List;

/**
 * One block of the migration template: the feature and story text shared by
 * every item of the block, and the sub-tasks created under each item's story.
 */
public record TemplateSection(
        String feature,
        String featureDescription,
        String featureAcceptanceCriteria,
        String story,
        String storyDescription,
        List<TemplateSubTask> subTasks
) {
    public TemplateSection {
        subTasks = subTasks == null ? List.of() : List.copyOf(subTasks);
    }
}
