package uk.gegc.docintake.features.storage.domain;

import java.util.Objects;

/**
 * Opaque locator returned by a {@link uk.gegc.docintake.features.storage.application.BlobStore},
 * shaped {@code scheme://container/unique-name}. It is the only handle kept to stored bytes.
 */
public record StoredObjectRef(String value) {

    public StoredObjectRef {
        Objects.requireNonNull(value, "value");
        if (!value.contains("://")) {
            throw new IllegalArgumentException("Not a stored object locator: " + value);
        }
    }

    public String scheme() {
        return value.substring(0, value.indexOf("://"));
    }

    /**
     * Part after {@code scheme://}, i.e. {@code container/unique-name}.
     */
    public String path() {
        return value.substring(value.indexOf("://") + 3);
    }

    @Override
    public String toString() {
        return value;
    }
}
