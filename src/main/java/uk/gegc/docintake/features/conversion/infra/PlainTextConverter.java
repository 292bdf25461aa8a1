package uk.gegc.docintake.features.conversion.infra;

import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.conversion.domain.ConversionResult;
import uk.gegc.docintake.features.conversion.domain.DocumentConverter;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Passthrough for text formats. Assumes UTF-8 and drops a leading byte order mark.
 */
@Component
public class PlainTextConverter implements DocumentConverter {

    private static final Set<String> EXTENSIONS = Set.of(".txt", ".csv", ".json", ".md");

    @Override
    public boolean supports(String fileName) {
        if (fileName == null) {
            return false;
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(lower::endsWith);
    }

    @Override
    public ConversionResult convert(byte[] bytes) {
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        return new ConversionResult(text);
    }
}
