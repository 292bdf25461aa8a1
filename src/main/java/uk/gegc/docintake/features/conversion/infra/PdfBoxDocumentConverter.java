package uk.gegc.docintake.features.conversion.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.conversion.domain.ConversionException;
import uk.gegc.docintake.features.conversion.domain.ConversionResult;
import uk.gegc.docintake.features.conversion.domain.DocumentConverter;

import java.io.ByteArrayInputStream;
import java.util.Locale;

/**
 * Extracts the text of every page, in page order, using Apache PDFBox.
 */
@Component
@Slf4j
public class PdfBoxDocumentConverter implements DocumentConverter {

    @Override
    public boolean supports(String fileName) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public ConversionResult convert(byte[] bytes) throws ConversionException {
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(bytes))) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text.append(stripper.getText(document));
            }

            log.debug("Converted PDF document: {} pages, {} bytes -> {} characters",
                    document.getNumberOfPages(), bytes.length, text.length());
            return new ConversionResult(text.toString());
        } catch (Exception e) {
            throw new ConversionException("Failed to convert PDF document: " + e.getMessage(), e);
        }
    }
}
