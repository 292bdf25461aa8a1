package uk.gegc.docintake.features.analysis.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Sentiment {
    POSITIVE("Positive"),
    NEGATIVE("Negative"),
    NEUTRAL("Neutral");

    private final String label;

    Sentiment(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Sentiment fromLabel(String value) {
        if (value != null) {
            for (Sentiment sentiment : values()) {
                if (sentiment.label.equalsIgnoreCase(value.trim())) {
                    return sentiment;
                }
            }
        }
        throw new IllegalArgumentException("Unknown sentiment: " + value);
    }
}
