package uk.gegc.docintake.features.upload.domain;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * Fully materialized upload. Every {@link #openStream()} starts from the first byte, so the
 * storage write and a processing path can each read the whole payload independently.
 * Owned by a single ingestion call and never shared.
 */
public final class UploadedBlob {

    private final byte[] content;
    private final String name;
    private final String mediaType;

    public UploadedBlob(byte[] content, String name, String mediaType) {
        this.content = Objects.requireNonNull(content, "content");
        this.name = name;
        this.mediaType = mediaType;
    }

    public InputStream openStream() {
        return new ByteArrayInputStream(content);
    }

    public byte[] copyBytes() {
        return Arrays.copyOf(content, content.length);
    }

    public long size() {
        return content.length;
    }

    public boolean isEmpty() {
        return content.length == 0;
    }

    public String name() {
        return name;
    }

    public String mediaType() {
        return mediaType;
    }

    @Override
    public String toString() {
        return "UploadedBlob[name=" + name + ", mediaType=" + mediaType + ", size=" + content.length + "]";
    }
}
