package uk.gegc.docintake.features.storage.application;

import org.apache.commons.io.FilenameUtils;
import org.springframework.util.InvalidMimeTypeException;
import org.springframework.util.MimeType;
import org.springframework.util.MimeTypeUtils;

import java.util.Locale;

/**
 * Extension based media type inference for uploads that arrive without a usable content type.
 */
public final class MediaTypes {

    public static final String OCTET_STREAM = "application/octet-stream";

    private MediaTypes() {
    }

    public static String inferFromFileName(String fileName) {
        String extension = FilenameUtils.getExtension(fileName == null ? "" : fileName).toLowerCase(Locale.ROOT);
        return switch (extension) {
            case "pdf" -> "application/pdf";
            case "txt" -> "text/plain";
            case "md" -> "text/markdown";
            case "csv" -> "text/csv";
            case "json" -> "application/json";
            case "xml" -> "application/xml";
            case "jpg", "jpeg" -> "image/jpeg";
            case "png" -> "image/png";
            case "gif" -> "image/gif";
            case "doc" -> "application/msword";
            case "docx" -> "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
            case "xls" -> "application/vnd.ms-excel";
            case "xlsx" -> "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
            default -> OCTET_STREAM;
        };
    }

    /**
     * Strips parameters and lower-cases: {@code "Text/CSV; charset=utf-8"} becomes {@code "text/csv"}.
     * Falls back to extension inference when the declared type is blank, unparseable, a wildcard
     * or the generic octet-stream.
     */
    public static String normalize(String declared, String fileName) {
        if (declared == null || declared.isBlank()) {
            return inferFromFileName(fileName);
        }
        MimeType parsed;
        try {
            parsed = MimeTypeUtils.parseMimeType(declared.trim());
        } catch (InvalidMimeTypeException e) {
            return inferFromFileName(fileName);
        }
        if (parsed.isWildcardType() || parsed.isWildcardSubtype()) {
            return inferFromFileName(fileName);
        }
        String base = (parsed.getType() + "/" + parsed.getSubtype()).toLowerCase(Locale.ROOT);
        if (OCTET_STREAM.equals(base)) {
            return inferFromFileName(fileName);
        }
        return base;
    }
}
