package uk.gegc.docintake.features.analysis.domain;

public class ContentExtractionException extends RuntimeException {

    public ContentExtractionException(String message) {
        super(message);
    }
}
