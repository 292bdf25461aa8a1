package uk.gegc.docintake.features.document.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.docintake.features.storage.domain.StoredObjectRef;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_owner_created", columnList = "owner_id, created_at")
})
@Getter
@Setter
@NoArgsConstructor
public class Document {

    public static final int MAX_DISPLAY_NAME_LENGTH = 255;
    public static final int MAX_MEDIA_TYPE_LENGTH = 150;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "display_name", nullable = false, length = MAX_DISPLAY_NAME_LENGTH)
    private String displayName;

    @Column(name = "media_type", nullable = false, length = MAX_MEDIA_TYPE_LENGTH)
    private String mediaType;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @Column(name = "storage_ref", nullable = false, length = 1024)
    private String storageRef;

    @Column(name = "processed", nullable = false)
    private boolean processed;

    @Column(name = "analysis_result", columnDefinition = "TEXT")
    private String analysisResult;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public Document(String displayName, String mediaType, long sizeBytes, StoredObjectRef storageRef, UUID ownerId) {
        this.displayName = displayName;
        this.mediaType = mediaType;
        this.sizeBytes = sizeBytes;
        this.storageRef = storageRef.value();
        this.ownerId = ownerId;
    }

    public StoredObjectRef storedObjectRef() {
        return new StoredObjectRef(storageRef);
    }

    public void markProcessed(String result) {
        this.processed = true;
        this.analysisResult = result;
    }

    public boolean isOwnedBy(UUID userId) {
        return ownerId != null && ownerId.equals(userId);
    }
}
