package uk.gegc.docintake.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.docintake.features.user.domain.model.UserRole;

import java.util.UUID;

@Schema(name = "AuthenticatedUserDto", description = "The currently authenticated user")
public record AuthenticatedUserDto(
        UUID id,
        String username,
        String email,
        UserRole role
) {
}
