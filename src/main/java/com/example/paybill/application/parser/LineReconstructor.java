package com.example.paybill.application.parser;

import com.example.paybill.domain.model.PageLines;
import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.ReconstructedDocument;
import com.example.paybill.domain.model.SourceDocument;
import com.example.paybill.domain.model.TextLine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Groups positioned tokens into reading-order lines. Purely geometric: no text is interpreted here.
 */
@Component
public class LineReconstructor {

    private static final Logger log = LoggerFactory.getLogger(LineReconstructor.class);

    /**
     * Rebuilds the lines of every page of a document.
     *
     * @param document tokens per page as produced by the text extractor
     * @return per-page lines (top of page first) and the flattened document view
     */
    public ReconstructedDocument reconstruct(SourceDocument document) {
        List<PageLines> pages = new ArrayList<>();
        List<TextLine> allLines = new ArrayList<>();
        for (int pageIndex = 0; pageIndex < document.pageCount(); pageIndex++) {
            PageLines page = reconstructPage(pageIndex + 1, document.pages().get(pageIndex));
            if (page.isEmpty()) {
                log.debug("Page {} of {} has no text tokens", pageIndex + 1, document.fileName());
            }
            pages.add(page);
            allLines.addAll(page.lines());
        }
        String rawText = allLines.stream()
                .map(TextLine::text)
                .collect(Collectors.joining("\n"));
        return new ReconstructedDocument(pages, allLines, rawText);
    }

    /**
     * Buckets tokens by their rounded y coordinate. Buckets are emitted highest y first,
     * tokens within a bucket left to right.
     *
     * @param pageNumber one-based page number
     * @param tokens     page tokens in extractor order
     * @return lines of the page
     */
    PageLines reconstructPage(int pageNumber, List<PositionedToken> tokens) {
        Map<Integer, List<PositionedToken>> buckets = new TreeMap<>(Comparator.reverseOrder());
        for (PositionedToken token : tokens) {
            buckets.computeIfAbsent(Math.round(token.y()), key -> new ArrayList<>()).add(token);
        }

        List<TextLine> lines = new ArrayList<>(buckets.size());
        for (Map.Entry<Integer, List<PositionedToken>> bucket : buckets.entrySet()) {
            List<PositionedToken> lineTokens = bucket.getValue();
            lineTokens.sort(Comparator.comparingDouble(PositionedToken::x));
            String text = lineTokens.stream()
                    .map(PositionedToken::text)
                    .collect(Collectors.joining(" "));
            lines.add(new TextLine(pageNumber, bucket.getKey(), lineTokens, text));
        }
        return new PageLines(pageNumber, lines);
    }
}
