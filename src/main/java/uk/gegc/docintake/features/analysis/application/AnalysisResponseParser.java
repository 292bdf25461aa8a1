package uk.gegc.docintake.features.analysis.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.analysis.domain.model.AnalysisResult;
import uk.gegc.docintake.shared.exception.ExternalServiceException;

/**
 * Parses raw analysis output into an {@link AnalysisResult}. Code fences around the JSON are
 * removed, property and enum names match case-insensitively and numbers are read as
 * {@link java.math.BigDecimal}.
 */
@Component
public class AnalysisResponseParser {

    private final JsonMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    public AnalysisResult parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ExternalServiceException("Empty response from analysis service.");
        }
        String json = stripCodeFences(raw);
        try {
            AnalysisResult result = mapper.readValue(json, AnalysisResult.class);
            if (result == null) {
                throw new ExternalServiceException("Failed to deserialize analysis response.");
            }
            return result;
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Failed to deserialize analysis response: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new ExternalServiceException("Analysis response violates the result contract: " + e.getMessage(), e);
        }
    }

    static String stripCodeFences(String raw) {
        return raw.replace("```json", "").replace("```", "").trim();
    }
}
