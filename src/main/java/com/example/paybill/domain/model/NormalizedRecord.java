package com.example.paybill.domain.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partial employee record produced by one document. {@code fields} keeps schema order;
 * {@code rawValues} keeps every parsed number, including those no column could label.
 */
public record NormalizedRecord(
        String employeeId,
        String name,
        String designation,
        Map<String, BigDecimal> fields,
        Map<String, FieldCategory> categories,
        List<BigDecimal> rawValues
) {
    public NormalizedRecord {
        name = name == null ? "" : name;
        designation = designation == null ? "" : designation;
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        categories = categories == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(categories));
        rawValues = rawValues == null ? List.of() : List.copyOf(rawValues);
    }
}
