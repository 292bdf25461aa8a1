package uk.gegc.docintake.features.analysis.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.docintake.features.analysis.domain.model.AnalysisResult;
import uk.gegc.docintake.features.analysis.domain.model.DocumentType;
import uk.gegc.docintake.features.analysis.domain.model.Sentiment;
import uk.gegc.docintake.shared.exception.ExternalServiceException;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisResponseParserTest {

    private final AnalysisResponseParser parser = new AnalysisResponseParser();

    @Test
    @DisplayName("invoice inside a json code fence is parsed with exact decimals")
    void parse_fencedInvoice() {
        String raw = """
                ```json
                {
                  "documentType": "Invoice",
                  "invoiceData": {
                    "clientName": "Acme",
                    "invoiceNumber": "INV-7",
                    "date": "2024-03-05",
                    "total": 0.30,
                    "products": [
                      {"name": "Widget", "quantity": 3, "unitPrice": 0.10, "total": 0.30}
                    ]
                  },
                  "informationData": null
                }
                ```
                """;

        AnalysisResult result = parser.parse(raw);

        assertThat(result.documentType()).isEqualTo(DocumentType.INVOICE);
        assertThat(result.informationData()).isNull();
        assertThat(result.invoiceData().invoiceNumber()).isEqualTo("INV-7");
        assertThat(result.invoiceData().date()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(result.invoiceData().total()).isEqualByComparingTo(new BigDecimal("0.30"));
        assertThat(result.invoiceData().products()).hasSize(1);
        assertThat(result.invoiceData().products().get(0).unitPrice()).isEqualByComparingTo("0.10");
    }

    @Test
    @DisplayName("property names and enum values match case-insensitively")
    void parse_caseInsensitive() {
        String raw = """
                {"DocumentType":"information","InformationData":{"Description":"Memo","Summary":"All good","Sentiment":"POSITIVE"}}
                """;

        AnalysisResult result = parser.parse(raw);

        assertThat(result.documentType()).isEqualTo(DocumentType.INFORMATION);
        assertThat(result.informationData().sentiment()).isEqualTo(Sentiment.POSITIVE);
        assertThat(result.invoiceData()).isNull();
    }

    @Test
    void parse_malformedJson_throwsExternalServiceException() {
        assertThatThrownBy(() -> parser.parse("{not json"))
                .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    @DisplayName("a result with both variants populated is rejected")
    void parse_bothVariants_throwsExternalServiceException() {
        String raw = """
                {"documentType":"Invoice","invoiceData":{"invoiceNumber":"1"},
                 "informationData":{"description":"x","summary":"y","sentiment":"Neutral"}}
                """;

        assertThatThrownBy(() -> parser.parse(raw))
                .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    void parse_unknownDocumentType_throwsExternalServiceException() {
        assertThatThrownBy(() -> parser.parse("{\"documentType\":\"Receipt\"}"))
                .isInstanceOf(ExternalServiceException.class);
    }

    @Test
    void parse_blank_throwsExternalServiceException() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(ExternalServiceException.class)
                .hasMessageContaining("Empty response");
    }
}
