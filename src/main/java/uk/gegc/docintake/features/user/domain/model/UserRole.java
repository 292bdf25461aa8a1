package uk.gegc.docintake.features.user.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum UserRole {
    ADMIN("Admin"),
    USER("User");

    private final String label;

    UserRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    /**
     * Case-insensitive lookup by label ("Admin", "user", ...). Unknown or blank tokens yield empty.
     */
    public static Optional<UserRole> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        String trimmed = token.trim();
        return Arrays.stream(values())
                .filter(role -> role.label.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
