package com.example.paybill.domain.model;

import java.util.List;

/**
 * Lines belonging to one employee: name lines printed above the data row, the data (anchor) line itself
 * and any continuation lines printed below it.
 */
public record EmployeeBlock(
        int serialNumber,
        String employeeId,
        List<TextLine> lines,
        TextLine anchor,
        int pageNumber
) {
    public EmployeeBlock {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }
}
