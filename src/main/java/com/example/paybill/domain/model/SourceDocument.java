package com.example.paybill.domain.model;

import java.util.List;

/**
 * Input contract handed over by the text extraction collaborator: one ordered token list per page.
 */
public record SourceDocument(
        String fileName,
        List<List<PositionedToken>> pages
) {
    public SourceDocument {
        fileName = fileName == null || fileName.isBlank() ? "document.pdf" : fileName;
        pages = pages == null ? List.of() : pages.stream().map(page -> page == null ? List.<PositionedToken>of() : List.copyOf(page)).toList();
    }

    public int pageCount() {
        return pages.size();
    }
}
