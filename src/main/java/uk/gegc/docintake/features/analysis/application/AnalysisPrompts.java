package uk.gegc.docintake.features.analysis.application;

public final class AnalysisPrompts {

    public static final String SYSTEM_INSTRUCTION = """
            You are an expert document analyzer. Analyze the provided document (text or image) and determine if it is an 'Invoice' or 'Information'.
            Return ONLY a valid JSON object matching this structure:
            {
                "documentType": "Invoice" | "Information",
                "invoiceData": {
                    "clientName": "string",
                    "clientAddress": "string",
                    "providerName": "string",
                    "providerAddress": "string",
                    "invoiceNumber": "string",
                    "date": "YYYY-MM-DD",
                    "total": 0.00,
                    "products": [
                        { "name": "string", "quantity": 0, "unitPrice": 0.00, "total": 0.00 }
                    ]
                },
                "informationData": {
                    "description": "string",
                    "summary": "string",
                    "sentiment": "Positive" | "Negative" | "Neutral"
                }
            }
            If it is an Invoice, populate 'invoiceData' and leave 'informationData' null.
            If it is Information, populate 'informationData' and leave 'invoiceData' null.
            Dates must be ISO 8601 date strings. Money values are plain decimal numbers.
            Do not use markdown code blocks in the response, just raw JSON.
            """;

    private AnalysisPrompts() {
    }
}
