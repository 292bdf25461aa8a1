package uk.gegc.docintake.shared.security;

import uk.gegc.docintake.features.user.domain.model.UserRole;

import java.util.UUID;

/**
 * The authenticated caller as seen by application services: owner id plus role.
 */
public record CallerIdentity(UUID userId, String username, UserRole role) {

    public boolean isAdmin() {
        return role == UserRole.ADMIN;
    }
}
