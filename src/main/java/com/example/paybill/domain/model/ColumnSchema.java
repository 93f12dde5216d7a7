package com.example.paybill.domain.model;

import java.util.List;

/**
 * Ordered column labels of one document, sorted by their horizontal position in the header zone.
 * Trailing numeric values of each data line are assigned to columns in this order.
 */
public record ColumnSchema(
        List<Column> columns,
        boolean valid,
        String rawHeaderText
) {
    public ColumnSchema {
        columns = columns == null ? List.of() : List.copyOf(columns);
        rawHeaderText = rawHeaderText == null ? "" : rawHeaderText;
    }

    /**
     * Schema used when the header zone holds no tokens at all.
     */
    public static ColumnSchema invalid() {
        return new ColumnSchema(List.of(), false, "");
    }

    public List<String> labels() {
        return columns.stream().map(Column::label).toList();
    }

    public int size() {
        return columns.size();
    }

    /**
     * A catalogue label resolved to the x-position of its header token.
     */
    public record Column(String label, float x) {
    }
}
