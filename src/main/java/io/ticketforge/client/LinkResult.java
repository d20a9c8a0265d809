package io.ticketforge.client;

import java.util.List;

public record LinkResult(String linkType, List<String> attemptedNames) {
    public LinkResult {
        attemptedNames = List.copyOf(attemptedNames);
    }
}
