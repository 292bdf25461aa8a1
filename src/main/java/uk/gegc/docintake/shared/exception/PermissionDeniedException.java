package uk.gegc.docintake.shared.exception;

import java.util.UUID;

public class PermissionDeniedException extends RuntimeException {

    public PermissionDeniedException(String message) {
        super(message);
    }

    public PermissionDeniedException(String username, UUID documentId, String operation) {
        super(String.format("User '%s' is not authorized to %s document with ID %s", username, operation, documentId));
    }
}
