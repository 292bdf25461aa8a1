package uk.gegc.docintake.shared.exception;

/**
 * A write that the caller relied on could not be committed. Any partial results
 * computed before the failure must be treated as discarded.
 */
public class FatalPersistenceException extends RuntimeException {

    public FatalPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
