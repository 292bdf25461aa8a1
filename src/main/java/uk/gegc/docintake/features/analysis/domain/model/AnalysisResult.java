package uk.gegc.docintake.features.analysis.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Outcome of a document analysis: exactly one of {@link InvoiceData} or {@link InformationData},
 * selected by {@link #documentType()}. The other variant is always {@code null}.
 */
public record AnalysisResult(
        DocumentType documentType,
        InvoiceData invoiceData,
        InformationData informationData
) {

    public AnalysisResult {
        if (documentType == null) {
            throw new IllegalArgumentException("documentType is required");
        }
        if (documentType == DocumentType.INVOICE && (invoiceData == null || informationData != null)) {
            throw new IllegalArgumentException("Invoice result must carry invoiceData only");
        }
        if (documentType == DocumentType.INFORMATION && (informationData == null || invoiceData != null)) {
            throw new IllegalArgumentException("Information result must carry informationData only");
        }
    }

    public static AnalysisResult invoice(InvoiceData invoiceData) {
        return new AnalysisResult(DocumentType.INVOICE, invoiceData, null);
    }

    public static AnalysisResult information(InformationData informationData) {
        return new AnalysisResult(DocumentType.INFORMATION, null, informationData);
    }

    /**
     * Result used whenever the external analysis fails. The summary always starts with "Error:".
     */
    public static AnalysisResult fallback(String errorMessage) {
        return information(new InformationData("Analysis Failed", "Error: " + errorMessage, Sentiment.NEUTRAL));
    }

    @JsonIgnore
    public boolean isInvoice() {
        return documentType == DocumentType.INVOICE;
    }
}
