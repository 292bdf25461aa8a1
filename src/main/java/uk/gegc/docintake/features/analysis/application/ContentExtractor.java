package uk.gegc.docintake.features.analysis.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.analysis.config.AnalysisProperties;
import uk.gegc.docintake.features.analysis.domain.AnalysisContent;
import uk.gegc.docintake.features.analysis.domain.ContentExtractionException;
import uk.gegc.docintake.features.conversion.domain.ConversionException;
import uk.gegc.docintake.features.conversion.domain.DocumentConverter;
import uk.gegc.docintake.features.upload.domain.UploadedBlob;

import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Turns an uploaded payload into the content part sent for analysis.
 * <p>
 * Images are sent as base64 with their MIME type. PDF and plain-text formats are converted to
 * text and truncated to {@code app.analysis.max-content-chars}. Any other type is sent as a
 * placeholder naming the file.
 */
@Component
@Slf4j
public class ContentExtractor {

    public static final String IMAGE_INSTRUCTION = "Analyze this image document.";
    public static final String TEXT_PREFIX = "Analyze this document content:\n\n";
    public static final String PDF_SENTINEL = "PDF content could not be extracted.";

    private final List<DocumentConverter> converters;
    private final AnalysisProperties properties;

    public ContentExtractor(List<DocumentConverter> converters, AnalysisProperties properties) {
        this.converters = converters;
        this.properties = properties;
    }

    public AnalysisContent extract(UploadedBlob blob, String fileName) {
        String extension = extensionOf(fileName);
        if (extension.equals(".png") || extension.equals(".jpg") || extension.equals(".jpeg")) {
            String mimeType = extension.equals(".png") ? "image/png" : "image/jpeg";
            return AnalysisContent.image(Base64.getEncoder().encodeToString(blob.copyBytes()), mimeType);
        }

        String text = extractText(blob, fileName, extension);
        if (text == null || text.isBlank()) {
            throw new ContentExtractionException("Could not extract text.");
        }
        if (text.length() > properties.getMaxContentChars()) {
            log.debug("Truncating {} from {} to {} characters", fileName, text.length(), properties.getMaxContentChars());
            text = text.substring(0, properties.getMaxContentChars());
        }
        return AnalysisContent.text(TEXT_PREFIX + text);
    }

    private String extractText(UploadedBlob blob, String fileName, String extension) {
        Optional<DocumentConverter> converter = converters.stream()
                .filter(c -> c.supports(fileName))
                .findFirst();
        if (converter.isEmpty()) {
            return "[File: " + fileName + "]";
        }
        try {
            return converter.get().convert(blob.copyBytes()).text();
        } catch (ConversionException e) {
            log.warn("Text extraction failed for {}: {}", fileName, e.getMessage());
            return extension.equals(".pdf") ? PDF_SENTINEL : "[File: " + fileName + "]";
        }
    }

    private static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
