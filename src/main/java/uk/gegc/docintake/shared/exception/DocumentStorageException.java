package uk.gegc.docintake.shared.exception;

/**
 * Exception thrown when a blob store read or write fails for reasons other than a missing object
 */
public class DocumentStorageException extends RuntimeException {

    public DocumentStorageException(String message) {
        super(message);
    }

    public DocumentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
