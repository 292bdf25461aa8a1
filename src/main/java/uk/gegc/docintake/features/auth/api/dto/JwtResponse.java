package uk.gegc.docintake.features.auth.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "JwtResponse", description = "Access token and its validity")
public record JwtResponse(
        @Schema(description = "Access token (JWT)", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
        String accessToken,

        @Schema(description = "Access token validity in milliseconds", example = "3600000")
        long accessExpiresInMs
) {
}
