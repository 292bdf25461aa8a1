package uk.gegc.docintake.features.document.domain.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Optional instruction supplied with an upload selecting the processing path.
 */
public enum ProcessHint {
    BULK_IMPORT("BulkImport"),
    ANALYZE("Analyze");

    private final String token;

    ProcessHint(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<ProcessHint> fromToken(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(hint -> hint.token.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
