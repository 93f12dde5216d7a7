package com.example.paybill.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Consolidated record for one employee across every earning and deduction document of a batch.
 * Total deductions and net pay live in the summary scalars, never in {@code deduction}.
 */
public record PayrollRecord(
        String employeeId,
        String name,
        String designation,
        Map<String, BigDecimal> earning,
        Map<String, BigDecimal> deduction,
        BigDecimal gross,
        BigDecimal totalDeductions,
        BigDecimal netPay
) {
    public PayrollRecord {
        name = name == null ? "" : name;
        designation = designation == null ? "" : designation;
        earning = earning == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(earning));
        deduction = deduction == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(deduction));
        gross = gross == null ? BigDecimal.ZERO : gross;
        totalDeductions = totalDeductions == null ? BigDecimal.ZERO : totalDeductions;
        netPay = netPay == null ? BigDecimal.ZERO : netPay;
    }
}
