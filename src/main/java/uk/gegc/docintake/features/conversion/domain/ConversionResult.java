package uk.gegc.docintake.features.conversion.domain;

public record ConversionResult(String text) {
}
