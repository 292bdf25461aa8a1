package uk.gegc.docintake.features.analysis.domain.model;

import java.math.BigDecimal;

public record LineItem(
        String name,
        BigDecimal quantity,
        BigDecimal unitPrice,
        BigDecimal total
) {
}
