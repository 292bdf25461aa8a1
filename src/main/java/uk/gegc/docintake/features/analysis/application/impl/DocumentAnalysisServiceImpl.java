package uk.gegc.docintake.features.analysis.application.impl;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import uk.gegc.docintake.features.analysis.application.AnalysisClient;
import uk.gegc.docintake.features.analysis.application.AnalysisPrompts;
import uk.gegc.docintake.features.analysis.application.AnalysisResponseParser;
import uk.gegc.docintake.features.analysis.application.ContentExtractor;
import uk.gegc.docintake.features.analysis.application.DocumentAnalysisService;
import uk.gegc.docintake.features.analysis.application.MockAnalysisResults;
import uk.gegc.docintake.features.analysis.config.AnalysisProperties;
import uk.gegc.docintake.features.analysis.domain.AnalysisContent;
import uk.gegc.docintake.features.analysis.domain.model.AnalysisResult;
import uk.gegc.docintake.features.analysis.domain.model.InformationData;
import uk.gegc.docintake.features.analysis.domain.model.InvoiceData;
import uk.gegc.docintake.features.audit.application.AuditService;
import uk.gegc.docintake.features.audit.domain.model.AuditEventTypes;
import uk.gegc.docintake.features.upload.domain.UploadedBlob;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

@Service
@Slf4j
public class DocumentAnalysisServiceImpl implements DocumentAnalysisService {

    static final String MOCK_WARNING = "Analysis API key not configured. Using mock.";

    private final ContentExtractor contentExtractor;
    private final AnalysisClient analysisClient;
    private final AnalysisResponseParser responseParser;
    private final AuditService auditService;
    private final AnalysisProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public DocumentAnalysisServiceImpl(ContentExtractor contentExtractor,
                                       AnalysisClient analysisClient,
                                       AnalysisResponseParser responseParser,
                                       AuditService auditService,
                                       AnalysisProperties properties,
                                       Clock clock,
                                       ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.contentExtractor = contentExtractor;
        this.analysisClient = analysisClient;
        this.responseParser = responseParser;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    @Override
    public AnalysisResult analyze(UploadedBlob blob, String fileName, UUID ownerId) {
        if (!properties.isExternalServiceConfigured()) {
            auditService.append(AuditEventTypes.AI_ANALYSIS_WARNING, MOCK_WARNING, ownerId);
            log.warn("Analysis credential missing, returning mock result for {}", fileName);
            simulateDelay();
            recordOutcome("mock");
            return MockAnalysisResults.forFile(fileName, LocalDate.now(clock));
        }

        AnalysisResult result;
        String eventType;
        String description;
        try {
            AnalysisContent content = contentExtractor.extract(blob, fileName);
            String raw = analysisClient.analyze(AnalysisPrompts.SYSTEM_INSTRUCTION, content);
            result = responseParser.parse(raw);
            eventType = AuditEventTypes.AI_ANALYSIS;
            description = "Analyzed " + fileName + ": " + summarize(result);
            log.info("Analyzed {} as {}", fileName, result.documentType().getLabel());
            recordOutcome("success");
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Analysis of {} failed, using fallback result: {}", fileName, message);
            result = AnalysisResult.fallback(message);
            eventType = AuditEventTypes.AI_ANALYSIS_ERROR;
            description = "Failed to analyze " + fileName + ": " + message;
            recordOutcome("fallback");
        }

        // audit failures are persistence failures and propagate
        auditService.append(eventType, description, ownerId);
        return result;
    }

    static String summarize(AnalysisResult result) {
        if (result.isInvoice()) {
            InvoiceData invoice = result.invoiceData();
            String total = invoice.total() != null
                    ? invoice.total().setScale(2, RoundingMode.HALF_UP).toPlainString()
                    : "";
            return "Invoice " + invoice.invoiceNumber() + " for " + total;
        }
        InformationData information = result.informationData();
        String summary = information.summary() != null ? information.summary() : "";
        return "Info: " + summary.substring(0, Math.min(50, summary.length())) + "...";
    }

    private void simulateDelay() {
        long millis = properties.getMockDelay().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Mock analysis delay interrupted");
        }
    }

    private void recordOutcome(String outcome) {
        if (meterRegistry != null) {
            meterRegistry.counter("analysis.results", "outcome", outcome).increment();
        }
    }
}
