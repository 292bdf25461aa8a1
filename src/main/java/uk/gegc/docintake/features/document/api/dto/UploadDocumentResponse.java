package uk.gegc.docintake.features.document.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "UploadDocumentResponse", description = "Stored document plus row errors of a bulk import")
public record UploadDocumentResponse(
        DocumentDto document,
        List<String> importErrors
) {
}
