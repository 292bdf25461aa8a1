package uk.gegc.docintake.features.document.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.document.api.dto.DocumentDto;
import uk.gegc.docintake.features.document.domain.model.Document;

@Component
@RequiredArgsConstructor
public class DocumentMapper {

    private final ObjectMapper objectMapper;

    public DocumentDto toDto(Document document) {
        if (document == null) {
            return null;
        }

        DocumentDto dto = new DocumentDto();
        dto.setId(document.getId());
        dto.setFileName(document.getDisplayName());
        dto.setMediaType(document.getMediaType());
        dto.setSizeBytes(document.getSizeBytes());
        dto.setProcessed(document.isProcessed());
        dto.setAnalysisResult(toJson(document.getAnalysisResult()));
        dto.setOwnerId(document.getOwnerId());
        dto.setCreatedAt(document.getCreatedAt());
        dto.setUpdatedAt(document.getUpdatedAt());
        return dto;
    }

    // analysis results are JSON objects; import summaries are plain text
    private JsonNode toJson(String result) {
        if (result == null) {
            return null;
        }
        String trimmed = result.trim();
        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                return TextNode.valueOf(result);
            }
        }
        return TextNode.valueOf(result);
    }
}
