package uk.gegc.docintake.features.user.application;

import java.util.List;

/**
 * Result of one bulk import. Row failures are reported here as line-numbered messages,
 * never as exceptions.
 */
public record ImportOutcome(int successCount, int failureCount, List<String> errors) {

    public ImportOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public String summary() {
        return "Processed: " + successCount + " success, " + failureCount + " failed.";
    }
}
