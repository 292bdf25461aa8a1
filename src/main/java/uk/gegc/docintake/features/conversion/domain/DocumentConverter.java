package uk.gegc.docintake.features.conversion.domain;

/**
 * Converts document bytes of one format family to plain text.
 */
public interface DocumentConverter {

    /**
     * @param fileName declared file name; the extension decides support
     */
    boolean supports(String fileName);

    ConversionResult convert(byte[] bytes) throws ConversionException;
}
