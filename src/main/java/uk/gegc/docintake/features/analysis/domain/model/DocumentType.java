package uk.gegc.docintake.features.analysis.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DocumentType {
    INVOICE("Invoice"),
    INFORMATION("Information");

    private final String label;

    DocumentType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Strict discriminator parsing: only the two labels (in any case) are accepted.
     */
    @JsonCreator
    public static DocumentType fromLabel(String value) {
        if (value != null) {
            for (DocumentType type : values()) {
                if (type.label.equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown documentType: " + value);
    }
}
