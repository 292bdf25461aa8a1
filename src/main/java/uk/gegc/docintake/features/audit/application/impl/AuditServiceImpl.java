package uk.gegc.docintake.features.audit.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import uk.gegc.docintake.features.audit.api.dto.AuditEventDto;
import uk.gegc.docintake.features.audit.api.dto.AuditEventMessage;
import uk.gegc.docintake.features.audit.application.AuditService;
import uk.gegc.docintake.features.audit.domain.model.AuditEvent;
import uk.gegc.docintake.features.audit.domain.repository.AuditEventRepository;
import uk.gegc.docintake.features.realtime.application.LiveEventPublisher;
import uk.gegc.docintake.features.realtime.domain.LiveEventTypes;
import uk.gegc.docintake.shared.exception.FatalPersistenceException;
import uk.gegc.docintake.shared.security.CallerIdentity;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class AuditServiceImpl implements AuditService {

    private final AuditEventRepository auditEventRepository;
    private final LiveEventPublisher liveEventPublisher;
    private final Clock clock;

    @Override
    public AuditEvent append(String eventType, String description, UUID ownerId) {
        AuditEvent saved;
        try {
            saved = auditEventRepository.save(new AuditEvent(eventType, description, ownerId, Instant.now(clock)));
        } catch (DataAccessException e) {
            throw new FatalPersistenceException("Failed to append audit event '" + eventType + "'", e);
        }
        log.info("Audit logged: {} (owner={}): {}", eventType, ownerId, description);

        AuditEventMessage message = AuditEventMessage.from(saved);
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publishQuietly(message);
                }
            });
        } else {
            publishQuietly(message);
        }
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Page<AuditEventDto> query(CallerIdentity caller, Pageable pageable) {
        Page<AuditEvent> events = caller.isAdmin()
                ? auditEventRepository.findAllByOrderByTimestampDesc(pageable)
                : auditEventRepository.findByOwnerIdOrderByTimestampDesc(caller.userId(), pageable);
        return events.map(AuditEventDto::from);
    }

    private void publishQuietly(AuditEventMessage message) {
        try {
            liveEventPublisher.publish(LiveEventTypes.RECEIVE_LOG, message);
        } catch (RuntimeException e) {
            log.warn("Live delivery of audit event {} failed: {}", message.id(), e.getMessage());
        }
    }
}
