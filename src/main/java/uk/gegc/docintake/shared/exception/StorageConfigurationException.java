package uk.gegc.docintake.shared.exception;

/**
 * Raised while constructing a blob store whose configuration is unusable
 * (missing credentials, unreachable or missing bucket).
 */
public class StorageConfigurationException extends RuntimeException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
