package com.example.paybill.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Batch-wide totals and the field keys actually observed in each category.
 */
public record ValidationSummary(
        int totalEmployees,
        BigDecimal totalGross,
        BigDecimal totalDeductions,
        BigDecimal totalNetPay,
        List<String> earningFieldsFound,
        List<String> deductionFieldsFound
) {
    public ValidationSummary {
        earningFieldsFound = earningFieldsFound == null ? List.of() : List.copyOf(earningFieldsFound);
        deductionFieldsFound = deductionFieldsFound == null ? List.of() : List.copyOf(deductionFieldsFound);
    }
}
