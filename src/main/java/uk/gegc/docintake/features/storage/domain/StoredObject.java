package uk.gegc.docintake.features.storage.domain;

public record StoredObject(byte[] content, String mediaType) {
}
