package com.example.paybill.domain.model;

import java.util.List;

/**
 * Result of processing a batch of paybill documents: merged records sorted by employee identifier,
 * the validation report and the batch metadata.
 */
public record PayrollBatchResult(
        List<PayrollRecord> payroll,
        ValidationResult validation,
        BatchMetadata metadata
) {
    public PayrollBatchResult {
        payroll = payroll == null ? List.of() : List.copyOf(payroll);
    }
}
