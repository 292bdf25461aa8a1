package uk.gegc.docintake.features.audit.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.docintake.features.audit.domain.model.AuditEvent;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "AuditEventDto", description = "An entry of the audit log")
public record AuditEventDto(
        UUID id,
        @Schema(example = "Document Upload") String eventType,
        @Schema(example = "User uploaded report.pdf") String description,
        UUID ownerId,
        Instant timestamp
) {

    public static AuditEventDto from(AuditEvent event) {
        return new AuditEventDto(event.getId(), event.getEventType(), event.getDescription(),
                event.getOwnerId(), event.getTimestamp());
    }
}
