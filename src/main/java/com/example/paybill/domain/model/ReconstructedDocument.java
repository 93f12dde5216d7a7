package com.example.paybill.domain.model;

import java.util.List;

/**
 * Output of line reconstruction: per-page lines plus the flattened line list and text used by
 * document-wide pattern scans.
 */
public record ReconstructedDocument(
        List<PageLines> pages,
        List<TextLine> lines,
        String rawText
) {
    public ReconstructedDocument {
        pages = pages == null ? List.of() : List.copyOf(pages);
        lines = lines == null ? List.of() : List.copyOf(lines);
        rawText = rawText == null ? "" : rawText;
    }

    /**
     * @return lines of the first page, or an empty list for a document without pages
     */
    public List<TextLine> firstPageLines() {
        return pages.isEmpty() ? List.of() : pages.get(0).lines();
    }
}
