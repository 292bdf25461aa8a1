package uk.gegc.docintake.features.upload.application;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Component;
import uk.gegc.docintake.features.upload.domain.UploadedBlob;
import uk.gegc.docintake.shared.exception.ValidationException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads an upload stream to the end exactly once and hands back an {@link UploadedBlob}.
 * The size recorded for a document is the buffered byte count, never a client supplied length.
 */
@Slf4j
@Component
public class ContentBuffer {

    public UploadedBlob capture(InputStreamSource source, String name, String mediaType) {
        try (InputStream in = source.getInputStream()) {
            return capture(in, name, mediaType);
        } catch (IOException e) {
            throw new ValidationException("Failed to read uploaded file " + name + ": " + e.getMessage(), e);
        }
    }

    public UploadedBlob capture(InputStream in, String name, String mediaType) {
        if (in == null) {
            throw new ValidationException("No content supplied for " + name);
        }
        try {
            byte[] bytes = IOUtils.toByteArray(in);
            log.debug("Buffered {} bytes for {}", bytes.length, name);
            return new UploadedBlob(bytes, name, mediaType);
        } catch (IOException e) {
            throw new ValidationException("Failed to read uploaded file " + name + ": " + e.getMessage(), e);
        }
    }
}
