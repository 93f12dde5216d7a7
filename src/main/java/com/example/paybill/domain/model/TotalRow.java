package com.example.paybill.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * The "Total" line printed at the end of a bill, kept as a checksum rather than as an employee.
 */
public record TotalRow(
        String rawText,
        int pageNumber,
        List<BigDecimal> values
) {
    public TotalRow {
        values = values == null ? List.of() : List.copyOf(values);
    }
}
