package uk.gegc.docintake.features.document.application;

import uk.gegc.docintake.features.document.domain.model.Document;

import java.util.List;

/**
 * @param importErrors row-level errors of a bulk import; empty for every other path
 */
public record IngestionResult(Document document, List<String> importErrors) {

    public IngestionResult {
        importErrors = importErrors == null ? List.of() : List.copyOf(importErrors);
    }
}
