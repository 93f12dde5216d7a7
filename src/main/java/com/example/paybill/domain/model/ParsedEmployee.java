package com.example.paybill.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Employee block after text parsing; {@code values} are still positional and unlabeled.
 */
public record ParsedEmployee(
        int serialNumber,
        String employeeId,
        String name,
        String designation,
        List<BigDecimal> values
) {
    public ParsedEmployee {
        designation = designation == null ? "" : designation;
        values = values == null ? List.of() : List.copyOf(values);
    }
}
