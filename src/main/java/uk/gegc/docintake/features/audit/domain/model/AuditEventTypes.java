package uk.gegc.docintake.features.audit.domain.model;

public final class AuditEventTypes {

    public static final String DOCUMENT_UPLOAD = "Document Upload";
    public static final String DOCUMENT_DELETE = "Document Delete";
    public static final String USER_IMPORT = "User Import";
    public static final String AI_ANALYSIS = "AI Analysis";
    public static final String AI_ANALYSIS_WARNING = "AI Analysis Warning";
    public static final String AI_ANALYSIS_ERROR = "AI Analysis Error";

    private AuditEventTypes() {
    }
}
