package io.ticketforge.plan;

import java.util.List;

/**
 * Raised by {@link PlanBuilder} before any remote call when the manifest is
 * malformed. Carries every violation found, not only the first one.
 */
public final class SpecValidationException extends RuntimeException {
    private final List<String> violations;

    public SpecValidationException(List<String> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> violations() {
        return violations;
    }

    private static String buildMessage(List<String> violations) {
        if (violations == null || violations.isEmpty()) {
            return "Invalid provisioning manifest";
        }
        return "Invalid provisioning manifest (" + violations.size() + " violation(s)): " + String.join("; ", violations);
    }
}
