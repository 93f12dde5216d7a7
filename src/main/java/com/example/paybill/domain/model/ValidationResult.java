package com.example.paybill.domain.model;

import java.util.List;

/**
 * Outcome of cross-validation. Errors and warnings are reported, never thrown; the caller decides
 * whether an invalid batch may be stored.
 */
public record ValidationResult(
        boolean valid,
        int totalRecords,
        int validRecords,
        List<String> errors,
        List<String> warnings,
        ValidationSummary summary
) {
    public ValidationResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
