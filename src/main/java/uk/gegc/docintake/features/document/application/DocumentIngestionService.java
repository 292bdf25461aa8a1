package uk.gegc.docintake.features.document.application;

import org.springframework.core.io.InputStreamSource;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.docintake.features.document.domain.model.Document;
import uk.gegc.docintake.features.document.domain.model.ProcessHint;
import uk.gegc.docintake.shared.security.CallerIdentity;

import java.io.InputStream;
import java.util.UUID;

/**
 * Entry point for uploads and for everything a user can do with their stored documents.
 */
public interface DocumentIngestionService {

    /**
     * Buffers the upload, runs the processing path selected by {@code processHint}, stores the
     * bytes and persists a fully formed record, then appends a "Document Upload" audit event.
     *
     * @param processHint {@code null} for no processing
     * @throws uk.gegc.docintake.shared.exception.ValidationException       empty or unreadable upload
     * @throws uk.gegc.docintake.shared.exception.PermissionDeniedException bulk import by a non-admin
     * @throws uk.gegc.docintake.shared.exception.FatalPersistenceException import commit or record write failed
     */
    IngestionResult ingest(InputStreamSource content, String name, String mediaType,
                           CallerIdentity caller, ProcessHint processHint);

    IngestionResult ingest(InputStream content, String name, String mediaType,
                           CallerIdentity caller, ProcessHint processHint);

    Page<Document> listMine(CallerIdentity caller, Pageable pageable);

    Document getDocument(UUID documentId, CallerIdentity caller);

    DocumentDownload download(UUID documentId, CallerIdentity caller);

    void delete(UUID documentId, CallerIdentity caller);
}
