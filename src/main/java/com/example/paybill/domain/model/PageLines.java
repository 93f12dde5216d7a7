package com.example.paybill.domain.model;

import java.util.List;

/**
 * Lines of a single page in reading order (top of page first).
 */
public record PageLines(
        int pageNumber,
        List<TextLine> lines
) {
    public PageLines {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
