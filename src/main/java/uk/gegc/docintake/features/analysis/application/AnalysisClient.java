package uk.gegc.docintake.features.analysis.application;

import uk.gegc.docintake.features.analysis.domain.AnalysisContent;

/**
 * Single request/response call to the external analysis service.
 */
public interface AnalysisClient {

    /**
     * @param instruction the output-schema instruction
     * @param content     extracted text or image content
     * @return raw response text, expected to hold one JSON object
     * @throws uk.gegc.docintake.shared.exception.ExternalServiceException on any transport,
     *                                                                    timeout or empty-response failure
     */
    String analyze(String instruction, AnalysisContent content);
}
