package uk.gegc.docintake.features.audit.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.docintake.features.audit.domain.model.AuditEvent;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    Page<AuditEvent> findAllByOrderByTimestampDesc(Pageable pageable);

    Page<AuditEvent> findByOwnerIdOrderByTimestampDesc(UUID ownerId, Pageable pageable);

    List<AuditEvent> findByEventTypeOrderByTimestampAsc(String eventType);
}
