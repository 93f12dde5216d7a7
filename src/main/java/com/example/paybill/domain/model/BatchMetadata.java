package com.example.paybill.domain.model;

import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

/**
 * Batch-level metadata. Month, bill number and office are the first values found across the documents
 * in input order.
 */
public record BatchMetadata(
        Instant processedAt,
        String month,
        String billNumber,
        String office,
        YearMonth period,
        List<DocumentSummary> documents,
        List<DocumentFailure> failures,
        int totalEmployees
) {
    public BatchMetadata {
        documents = documents == null ? List.of() : List.copyOf(documents);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
