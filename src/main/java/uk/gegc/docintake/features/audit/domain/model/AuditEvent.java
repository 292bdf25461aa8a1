package uk.gegc.docintake.features.audit.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit record. Rows are never updated or deleted.
 */
@Entity
@Immutable
@Table(name = "audit_events", indexes = {
        @Index(name = "idx_audit_owner_ts", columnList = "owner_id, event_timestamp"),
        @Index(name = "idx_audit_ts", columnList = "event_timestamp")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "event_type", nullable = false, length = 100, updatable = false)
    private String eventType;

    @Column(name = "description", columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(name = "owner_id", updatable = false)
    private UUID ownerId;

    @Column(name = "event_timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    public AuditEvent(String eventType, String description, UUID ownerId, Instant timestamp) {
        this.eventType = eventType;
        this.description = description;
        this.ownerId = ownerId;
        this.timestamp = timestamp;
    }
}
