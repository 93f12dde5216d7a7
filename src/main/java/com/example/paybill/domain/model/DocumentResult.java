package com.example.paybill.domain.model;

import java.util.List;

/**
 * Everything a single paybill document produced before the cross-document merge.
 */
public record DocumentResult(
        String fileName,
        DocumentMeta meta,
        ColumnSchema schema,
        List<NormalizedHeader> headers,
        List<NormalizedRecord> records,
        TotalRow totalRow,
        List<String> diagnostics,
        int pageCount
) {
    public DocumentResult {
        headers = headers == null ? List.of() : List.copyOf(headers);
        records = records == null ? List.of() : List.copyOf(records);
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    public BillType billType() {
        return meta.billType();
    }
}
