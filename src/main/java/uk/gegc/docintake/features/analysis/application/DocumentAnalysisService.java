package uk.gegc.docintake.features.analysis.application;

import uk.gegc.docintake.features.analysis.domain.model.AnalysisResult;
import uk.gegc.docintake.features.upload.domain.UploadedBlob;

import java.util.UUID;

public interface DocumentAnalysisService {

    /**
     * Analyzes one uploaded document. Never fails because of the external service: any
     * extraction, transport or parse failure yields {@link AnalysisResult#fallback(String)}.
     * Exactly one audit event is appended per call.
     *
     * @param ownerId owner recorded on the audit event, may be {@code null}
     */
    AnalysisResult analyze(UploadedBlob blob, String fileName, UUID ownerId);
}
