package uk.gegc.docintake.features.analysis.application;

import uk.gegc.docintake.features.analysis.domain.model.AnalysisResult;
import uk.gegc.docintake.features.analysis.domain.model.InformationData;
import uk.gegc.docintake.features.analysis.domain.model.InvoiceData;
import uk.gegc.docintake.features.analysis.domain.model.LineItem;
import uk.gegc.docintake.features.analysis.domain.model.Sentiment;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Deterministic results used when no analysis credential is configured.
 */
public final class MockAnalysisResults {

    private static final BigDecimal MOCK_TOTAL = new BigDecimal("1500.00");

    private MockAnalysisResults() {
    }

    public static AnalysisResult forFile(String fileName, LocalDate today) {
        if (fileName != null && fileName.toLowerCase(Locale.ROOT).contains("invoice")) {
            return AnalysisResult.invoice(new InvoiceData(
                    "Tech Solutions Inc.",
                    "123 Innovation Dr",
                    "Cloud Services LLC",
                    "456 Server Ave",
                    "INV-MOCK-001",
                    today,
                    MOCK_TOTAL,
                    List.of(new LineItem("Mock Service", BigDecimal.ONE, MOCK_TOTAL, MOCK_TOTAL))
            ));
        }
        return AnalysisResult.information(new InformationData("Mock Info", "This is a mock response.", Sentiment.NEUTRAL));
    }
}
