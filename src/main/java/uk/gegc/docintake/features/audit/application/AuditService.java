package uk.gegc.docintake.features.audit.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.docintake.features.audit.api.dto.AuditEventDto;
import uk.gegc.docintake.features.audit.domain.model.AuditEvent;
import uk.gegc.docintake.shared.security.CallerIdentity;

import java.util.UUID;

public interface AuditService {

    /**
     * Persists the event, then pushes it to live subscribers. The push happens only after the
     * event is durable and a failed push never undoes or fails the append.
     *
     * @param ownerId user the event belongs to; {@code null} for system events
     * @throws uk.gegc.docintake.shared.exception.FatalPersistenceException if the event cannot be stored
     */
    AuditEvent append(String eventType, String description, UUID ownerId);

    /**
     * Admins see every event; everybody else sees only events they own. Newest first.
     */
    Page<AuditEventDto> query(CallerIdentity caller, Pageable pageable);
}
