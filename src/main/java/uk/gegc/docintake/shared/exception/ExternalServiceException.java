package uk.gegc.docintake.shared.exception;

/**
 * Exception thrown when the external analysis service fails, times out or returns
 * output that does not satisfy the expected schema
 */
public class ExternalServiceException extends RuntimeException {

    public ExternalServiceException(String message) {
        super(message);
    }

    public ExternalServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
