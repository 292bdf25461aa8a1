package uk.gegc.docintake.shared.exception;

/**
 * Thrown when caller-supplied input cannot be accepted, e.g. an empty or unreadable upload.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
