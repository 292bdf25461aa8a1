package uk.gegc.docintake.features.document.application;

public record DocumentDownload(byte[] content, String mediaType, String fileName) {
}
