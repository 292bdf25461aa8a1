package uk.gegc.docintake.shared.exception;

import java.util.UUID;

public class DocumentNotFoundException extends ResourceNotFoundException {

    public DocumentNotFoundException(UUID documentId) {
        super(String.format("Document with ID %s not found", documentId));
    }
}
