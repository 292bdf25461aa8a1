package uk.gegc.docintake.features.document.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
@Schema(name = "DocumentDto", description = "Stored document with its processing result")
public class DocumentDto {
    @Schema(description = "Document UUID")
    private UUID id;

    @Schema(description = "File name as uploaded", example = "invoice_2024.pdf")
    private String fileName;

    @Schema(description = "Normalized media type", example = "application/pdf")
    private String mediaType;

    @Schema(description = "Size in bytes as buffered on upload", example = "1048576")
    private long sizeBytes;

    @Schema(description = "True once an import or analysis result is attached")
    private boolean processed;

    @Schema(description = "Analysis result as JSON, or the import summary as a string")
    private JsonNode analysisResult;

    @Schema(description = "Owner user id")
    private UUID ownerId;

    private Instant createdAt;

    private Instant updatedAt;
}
