package uk.gegc.docintake.features.document.application.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.io.InputStreamSource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import uk.gegc.docintake.features.analysis.application.DocumentAnalysisService;
import uk.gegc.docintake.features.analysis.domain.model.AnalysisResult;
import uk.gegc.docintake.features.audit.application.AuditService;
import uk.gegc.docintake.features.audit.domain.model.AuditEventTypes;
import uk.gegc.docintake.features.document.application.DocumentDownload;
import uk.gegc.docintake.features.document.application.DocumentIngestionService;
import uk.gegc.docintake.features.document.application.IngestionResult;
import uk.gegc.docintake.features.document.domain.model.Document;
import uk.gegc.docintake.features.document.domain.model.ProcessHint;
import uk.gegc.docintake.features.document.domain.repository.DocumentRepository;
import uk.gegc.docintake.features.storage.application.BlobStore;
import uk.gegc.docintake.features.storage.application.MediaTypes;
import uk.gegc.docintake.features.storage.domain.StoredObject;
import uk.gegc.docintake.features.storage.domain.StoredObjectRef;
import uk.gegc.docintake.features.upload.application.ContentBuffer;
import uk.gegc.docintake.features.upload.domain.UploadedBlob;
import uk.gegc.docintake.features.user.application.ImportOutcome;
import uk.gegc.docintake.features.user.application.UserImportService;
import uk.gegc.docintake.shared.exception.DocumentNotFoundException;
import uk.gegc.docintake.shared.exception.FatalPersistenceException;
import uk.gegc.docintake.shared.exception.PermissionDeniedException;
import uk.gegc.docintake.shared.exception.ResourceNotFoundException;
import uk.gegc.docintake.shared.exception.ValidationException;
import uk.gegc.docintake.shared.security.CallerIdentity;

import java.io.InputStream;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentIngestionServiceImpl implements DocumentIngestionService {

    private static final String CSV = "text/csv";

    private final ContentBuffer contentBuffer;
    private final BlobStore blobStore;
    private final DocumentRepository documentRepository;
    private final UserImportService userImportService;
    private final DocumentAnalysisService documentAnalysisService;
    private final AuditService auditService;
    private final ObjectMapper objectMapper;

    @Override
    public IngestionResult ingest(InputStreamSource content, String name, String mediaType,
                                  CallerIdentity caller, ProcessHint processHint) {
        return ingest(contentBuffer.capture(content, name, mediaType), caller, processHint);
    }

    @Override
    public IngestionResult ingest(InputStream content, String name, String mediaType,
                                  CallerIdentity caller, ProcessHint processHint) {
        return ingest(contentBuffer.capture(content, name, mediaType), caller, processHint);
    }

    private IngestionResult ingest(UploadedBlob blob, CallerIdentity caller, ProcessHint processHint) {
        if (blob.isEmpty()) {
            throw new ValidationException("File is empty");
        }
        String fileName = fitDisplayName(blob.name());
        String mediaType = MediaTypes.normalize(blob.mediaType(), fileName);
        if (mediaType.length() > Document.MAX_MEDIA_TYPE_LENGTH) {
            log.debug("Declared media type of {} is too long to store; inferring from the name", fileName);
            mediaType = MediaTypes.inferFromFileName(fileName);
        }

        String resultText = null;
        List<String> importErrors = List.of();

        if (processHint == ProcessHint.BULK_IMPORT && CSV.equals(mediaType)) {
            if (!caller.isAdmin()) {
                throw new PermissionDeniedException("Only admins can perform bulk user uploads.");
            }
            ImportOutcome outcome = userImportService.importUsers(blob);
            resultText = outcome.summary();
            importErrors = outcome.errors();
            auditService.append(AuditEventTypes.USER_IMPORT,
                    "Imported users from " + fileName + ": " + resultText, caller.userId());
        } else if (processHint == ProcessHint.ANALYZE) {
            AnalysisResult analysis = documentAnalysisService.analyze(blob, fileName, caller.userId());
            resultText = serialize(analysis);
        }

        StoredObjectRef ref = blobStore.put(fileName, mediaType, blob.copyBytes());

        Document document = new Document(fileName, mediaType, blob.size(), ref, caller.userId());
        if (resultText != null) {
            document.markProcessed(resultText);
        }

        Document saved;
        try {
            saved = documentRepository.save(document);
        } catch (DataAccessException e) {
            discardStoredObject(ref);
            log.error("Failed to persist document record for {}", fileName, e);
            throw new FatalPersistenceException("Failed to save document " + fileName, e);
        }

        log.info("Stored document {} ({} bytes, {}) for user {} at {}",
                saved.getId(), saved.getSizeBytes(), mediaType, caller.username(), blobStore.backendName());
        auditService.append(AuditEventTypes.DOCUMENT_UPLOAD, "User uploaded " + fileName, caller.userId());

        return new IngestionResult(saved, importErrors);
    }

    @Override
    public Page<Document> listMine(CallerIdentity caller, Pageable pageable) {
        return documentRepository.findByOwnerIdOrderByCreatedAtDesc(caller.userId(), pageable);
    }

    @Override
    public Document getDocument(UUID documentId, CallerIdentity caller) {
        return loadOwned(documentId, caller, "view");
    }

    @Override
    public DocumentDownload download(UUID documentId, CallerIdentity caller) {
        Document document = loadOwned(documentId, caller, "download");
        StoredObject stored = blobStore.get(document.storedObjectRef());
        String mediaType = stored.mediaType() != null ? stored.mediaType() : document.getMediaType();
        return new DocumentDownload(stored.content(), mediaType, document.getDisplayName());
    }

    @Override
    public void delete(UUID documentId, CallerIdentity caller) {
        Document document = loadOwned(documentId, caller, "delete");
        try {
            documentRepository.delete(document);
        } catch (DataAccessException e) {
            throw new FatalPersistenceException("Failed to delete document " + documentId, e);
        }

        // the record is gone; leftover bytes are only logged
        try {
            blobStore.delete(document.storedObjectRef());
        } catch (ResourceNotFoundException e) {
            log.warn("Stored bytes for document {} were already gone: {}", documentId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not remove stored bytes for deleted document {}: {}", documentId, e.getMessage());
        }
        log.info("Deleted document {} for user {}", documentId, caller.username());
        auditService.append(AuditEventTypes.DOCUMENT_DELETE, "User deleted " + document.getDisplayName(), caller.userId());
    }

    private Document loadOwned(UUID documentId, CallerIdentity caller, String operation) {
        Document document = documentRepository.findById(documentId)
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
        if (!document.isOwnedBy(caller.userId())) {
            throw new PermissionDeniedException(caller.username(), documentId, operation);
        }
        return document;
    }

    /**
     * Shortens over-long names to the column width, keeping the extension so that media type
     * inference and downloads still see it.
     */
    static String fitDisplayName(String name) {
        if (name == null || name.length() <= Document.MAX_DISPLAY_NAME_LENGTH) {
            return name;
        }
        String extension = FilenameUtils.getExtension(name);
        String suffix = extension.isEmpty() || extension.length() >= 16 ? "" : "." + extension;
        return name.substring(0, Document.MAX_DISPLAY_NAME_LENGTH - suffix.length()) + suffix;
    }

    private String serialize(AnalysisResult analysis) {
        try {
            return objectMapper.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Analysis result is not serializable", e);
        }
    }

    private void discardStoredObject(StoredObjectRef ref) {
        try {
            blobStore.delete(ref);
        } catch (RuntimeException cleanupFailure) {
            log.warn("Could not remove orphaned stored object {}: {}", ref, cleanupFailure.getMessage());
        }
    }
}
