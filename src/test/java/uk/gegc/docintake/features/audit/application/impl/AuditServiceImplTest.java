package uk.gegc.docintake.features.audit.application.impl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import uk.gegc.docintake.BaseUnitTest;
import uk.gegc.docintake.features.audit.api.dto.AuditEventDto;
import uk.gegc.docintake.features.audit.api.dto.AuditEventMessage;
import uk.gegc.docintake.features.audit.domain.model.AuditEvent;
import uk.gegc.docintake.features.audit.domain.repository.AuditEventRepository;
import uk.gegc.docintake.features.realtime.application.LiveEventPublisher;
import uk.gegc.docintake.features.realtime.domain.LiveEventTypes;
import uk.gegc.docintake.features.user.domain.model.UserRole;
import uk.gegc.docintake.shared.exception.FatalPersistenceException;
import uk.gegc.docintake.shared.security.CallerIdentity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AuditServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");
    private static final UUID OWNER = UUID.fromString("11111111-1111-1111-1111-111111111111");

    @Mock
    private AuditEventRepository repository;

    @Mock
    private LiveEventPublisher publisher;

    private AuditServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new AuditServiceImpl(repository, publisher, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void clearSynchronization() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("event is persisted before it is published")
    void append_persistsThenPublishes() {
        when(repository.save(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AuditEvent event = service.append("Document Upload", "User uploaded a.pdf", OWNER);

        assertThat(event.getTimestamp()).isEqualTo(NOW);
        assertThat(event.getOwnerId()).isEqualTo(OWNER);
        InOrder order = inOrder(repository, publisher);
        order.verify(repository).save(any(AuditEvent.class));
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        order.verify(publisher).publish(eq(LiveEventTypes.RECEIVE_LOG), payload.capture());
        AuditEventMessage message = (AuditEventMessage) payload.getValue();
        assertThat(message.eventType()).isEqualTo("Document Upload");
        assertThat(message.details()).isEqualTo("User uploaded a.pdf");
    }

    @Test
    @DisplayName("a failing publish never fails the append")
    void append_publishFailure_isSwallowed() {
        when(repository.save(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        doThrow(new IllegalStateException("socket closed")).when(publisher).publish(anyString(), any());

        AuditEvent event = service.append("User Import", "done", OWNER);

        assertThat(event.getEventType()).isEqualTo("User Import");
    }

    @Test
    @DisplayName("a storage failure is fatal and nothing is published")
    void append_saveFailure_throwsFatal() {
        when(repository.save(any(AuditEvent.class))).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatThrownBy(() -> service.append("Document Upload", "x", OWNER))
                .isInstanceOf(FatalPersistenceException.class);
        verifyNoInteractions(publisher);
    }

    @Test
    @DisplayName("inside a transaction the publish waits for commit")
    void append_inTransaction_publishesAfterCommit() {
        when(repository.save(any(AuditEvent.class))).thenAnswer(invocation -> invocation.getArgument(0));
        TransactionSynchronizationManager.initSynchronization();

        service.append("Document Delete", "User deleted a.pdf", OWNER);

        verify(publisher, never()).publish(anyString(), any());
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        assertThat(synchronizations).hasSize(1);
        synchronizations.forEach(TransactionSynchronization::afterCommit);
        verify(publisher).publish(eq(LiveEventTypes.RECEIVE_LOG), any(AuditEventMessage.class));
    }

    @Test
    @DisplayName("admins query every event, other users only their own")
    void query_filtersByRole() {
        Pageable pageable = PageRequest.of(0, 10);
        AuditEvent event = new AuditEvent("Document Upload", "x", OWNER, NOW);
        when(repository.findAllByOrderByTimestampDesc(pageable)).thenReturn(new PageImpl<>(List.of(event)));
        when(repository.findByOwnerIdOrderByTimestampDesc(OWNER, pageable)).thenReturn(new PageImpl<>(List.of(event)));

        Page<AuditEventDto> all = service.query(new CallerIdentity(UUID.randomUUID(), "root", UserRole.ADMIN), pageable);
        Page<AuditEventDto> own = service.query(new CallerIdentity(OWNER, "alice", UserRole.USER), pageable);

        assertThat(all.getContent()).hasSize(1);
        assertThat(own.getContent()).extracting(AuditEventDto::ownerId).containsExactly(OWNER);
        verify(repository).findAllByOrderByTimestampDesc(pageable);
        verify(repository).findByOwnerIdOrderByTimestampDesc(OWNER, pageable);
    }
}
