package io.ticketforge.model;

/**
 * One record to realise remotely, as yielded by a metadata source.
 *
 * <p>{@code acceptanceCriteria} is a separate field and is never folded into
 * {@code description}. {@code parentRef} is only meaningful for sub-tasks,
 * {@code featureRef} for stories and {@code epicRef} for features.
 */
public record RecordSpec(
        String ref,
        RecordKind kind,
        String groupKey,
        String summary,
        String description,
        String acceptanceCriteria,
        String parentRef,
        String featureRef,
        String epicRef
) {
    public static RecordSpec feature(String ref, String groupKey, String summary, String description,
                                     String acceptanceCriteria, String epicRef) {
        return new RecordSpec(ref, RecordKind.FEATURE, groupKey, summary, description, acceptanceCriteria, null, null, epicRef);
    }

    public static RecordSpec story(String ref, String groupKey, String summary, String description,
                                   String acceptanceCriteria, String featureRef) {
        return new RecordSpec(ref, RecordKind.STORY, groupKey, summary, description, acceptanceCriteria, null, featureRef, null);
    }

    public static RecordSpec subTask(String ref, String groupKey, String summary, String description,
                                     String acceptanceCriteria, String parentRef) {
        return new RecordSpec(ref, RecordKind.SUB_TASK, groupKey, summary, description, acceptanceCriteria, parentRef, null, null);
    }

    public boolean hasAcceptanceCriteria() {
        return acceptanceCriteria != null && !acceptanceCriteria.isBlank();
    }
}
