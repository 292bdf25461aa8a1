package uk.gegc.docintake.features.analysis.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * @param date     invoice date, absent when the document does not state one
 * @param products line items in document order
 */
public record InvoiceData(
        String clientName,
        String clientAddress,
        String providerName,
        String providerAddress,
        String invoiceNumber,
        LocalDate date,
        BigDecimal total,
        List<LineItem> products
) {

    public InvoiceData {
        products = products == null ? List.of() : List.copyOf(products);
    }
}
