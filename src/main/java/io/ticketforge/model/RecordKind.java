package io.ticketforge.model;

public enum RecordKind {
    FEATURE("feature", "New Feature"),
    STORY("story", "Story"),
    SUB_TASK("sub-task", "Sub-task");

    private final String code;
    private final String issueTypeName;

    RecordKind(String code, String issueTypeName) {
        this.code = code;
        this.issueTypeName = issueTypeName;
    }

    public String code() {
        return code;
    }

    public String issueTypeName() {
        return issueTypeName;
    }

    public static RecordKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Record kind is required");
        }
        String normalized = raw.trim().replace('_', '-');
        for (RecordKind value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())
                    || value.code.equalsIgnoreCase(normalized)
                    || value.issueTypeName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        if ("subtask".equalsIgnoreCase(normalized)) {
            return SUB_TASK;
        }
        throw new IllegalArgumentException("Unknown record kind: " + raw);
    }
}
