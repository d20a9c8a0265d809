package io.ticketforge.source;

public record TemplateSubTask(String summary, String description, String acceptanceCriteria) {
}
