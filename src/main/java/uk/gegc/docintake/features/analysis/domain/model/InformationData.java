package uk.gegc.docintake.features.analysis.domain.model;

public record InformationData(
        String description,
        String summary,
        Sentiment sentiment
) {
}
