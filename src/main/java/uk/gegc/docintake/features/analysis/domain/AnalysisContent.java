package uk.gegc.docintake.features.analysis.domain;

/**
 * What is sent to the analysis service for one document: either text, or a base64 image
 * with its MIME type.
 */
public record AnalysisContent(Kind kind, String text, String imageBase64, String imageMimeType) {

    public enum Kind {
        TEXT,
        IMAGE
    }

    public static AnalysisContent text(String text) {
        return new AnalysisContent(Kind.TEXT, text, null, null);
    }

    public static AnalysisContent image(String imageBase64, String imageMimeType) {
        return new AnalysisContent(Kind.IMAGE, null, imageBase64, imageMimeType);
    }
}
