package com.example.paybill.domain.model;

import java.util.List;

/**
 * Per-document entry of the batch metadata.
 */
public record DocumentSummary(
        String fileName,
        BillType billType,
        String month,
        String billNumber,
        int recordCount,
        List<String> columns,
        List<String> diagnostics
) {
    public DocumentSummary {
        columns = columns == null ? List.of() : List.copyOf(columns);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public static DocumentSummary of(DocumentResult result) {
        return new DocumentSummary(
                result.fileName(),
                result.billType(),
                result.meta().month(),
                result.meta().billNumber(),
                result.records().size(),
                result.schema().labels(),
                result.diagnostics()
        );
    }
}
