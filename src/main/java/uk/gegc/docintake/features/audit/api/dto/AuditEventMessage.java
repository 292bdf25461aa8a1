package uk.gegc.docintake.features.audit.api.dto;

import uk.gegc.docintake.features.audit.domain.model.AuditEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload of the {@code ReceiveLog} live message.
 */
public record AuditEventMessage(UUID id, String eventType, String details, Instant timestamp) {

    public static AuditEventMessage from(AuditEvent event) {
        return new AuditEventMessage(event.getId(), event.getEventType(), event.getDescription(), event.getTimestamp());
    }
}
