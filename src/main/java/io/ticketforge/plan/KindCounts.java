package io.ticketforge.plan;

import io.ticketforge.model.RecordKind;

public record KindCounts(int features, int stories, int subTasks, int links, int fieldUpdates) {
    public static final KindCounts ZERO = new KindCounts(0, 0, 0, 0, 0);

    public int count(RecordKind kind) {
        return switch (kind) {
            case FEATURE -> features;
            case STORY -> stories;
            case SUB_TASK -> subTasks;
        };
    }

    public KindCounts withCreate(RecordKind kind) {
        return switch (kind) {
            case FEATURE -> new KindCounts(features + 1, stories, subTasks, links, fieldUpdates);
            case STORY -> new KindCounts(features, stories + 1, subTasks, links, fieldUpdates);
            case SUB_TASK -> new KindCounts(features, stories, subTasks + 1, links, fieldUpdates);
        };
    }

    public KindCounts withLink() {
        return new KindCounts(features, stories, subTasks, links + 1, fieldUpdates);
    }

    public KindCounts withFieldUpdate() {
        return new KindCounts(features, stories, subTasks, links, fieldUpdates + 1);
    }

    public KindCounts plus(KindCounts other) {
        return new KindCounts(
                features + other.features,
                stories + other.stories,
                subTasks + other.subTasks,
                links + other.links,
                fieldUpdates + other.fieldUpdates
        );
    }

    public KindCounts minus(KindCounts other) {
        return new KindCounts(
                features - other.features,
                stories - other.stories,
                subTasks - other.subTasks,
                links - other.links,
                fieldUpdates - other.fieldUpdates
        );
    }

    public int total() {
        return features + stories + subTasks + links + fieldUpdates;
    }

    public boolean isZero() {
        return features == 0 && stories == 0 && subTasks == 0 && links == 0 && fieldUpdates == 0;
    }
}
