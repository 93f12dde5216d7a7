package com.example.paybill.application.parser;

import com.example.paybill.domain.model.EmployeeBlock;
import com.example.paybill.domain.model.PageLines;
import com.example.paybill.domain.model.TextLine;
import com.example.paybill.domain.model.TotalRow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Splits the pages of a bill into one line group per employee.
 * <p>
 * Every line starting with a serial number and an 8-digit identifier is an anchor (the employee's data row).
 * Name lines printed above an anchor are collected backwards up to the honorific that starts the name;
 * continuation lines printed below it are collected up to the next anchor, total row or honorific.
 */
@Component
public class RowSegmenter {

    private static final Logger log = LoggerFactory.getLogger(RowSegmenter.class);

    /**
     * @param pages reconstructed pages of one document
     * @return employee blocks in document order, the last total row seen and any diagnostics
     */
    public Segmentation segment(List<PageLines> pages) {
        List<EmployeeBlock> blocks = new ArrayList<>();
        List<String> diagnostics = new ArrayList<>();
        TotalRow totalRow = null;

        for (PageLines page : pages) {
            List<TextLine> lines = page.lines();
            List<Integer> anchors = new ArrayList<>();
            for (int i = 0; i < lines.size(); i++) {
                String text = lines.get(i).text();
                if (LineRules.isAnchor(text)) {
                    anchors.add(i);
                }
                if (LineRules.isTotal(text)) {
                    totalRow = new TotalRow(text, page.pageNumber(), LineRules.extractNumbers(text));
                }
            }
            if (anchors.isEmpty()) {
                continue;
            }

            int headerEnd = findHeaderEnd(lines);
            for (int d = 0; d < anchors.size(); d++) {
                int anchorIndex = anchors.get(d);
                int regionStart = d == 0 ? headerEnd : anchors.get(d - 1) + 1;
                int nextBoundary = d < anchors.size() - 1 ? anchors.get(d + 1) : lines.size();

                EmployeeBlock block = buildBlock(page.pageNumber(), lines, regionStart, anchorIndex, nextBoundary, d == 0, diagnostics);
                if (block != null) {
                    blocks.add(block);
                }
            }
        }
        return new Segmentation(blocks, totalRow, diagnostics);
    }

    private EmployeeBlock buildBlock(int pageNumber,
                                     List<TextLine> lines,
                                     int regionStart,
                                     int anchorIndex,
                                     int nextBoundary,
                                     boolean firstOnPage,
                                     List<String> diagnostics) {
        TextLine anchor = lines.get(anchorIndex);
        Matcher matcher = LineRules.ANCHOR.matcher(anchor.text());
        if (!matcher.find()) {
            return null;
        }
        int serialNumber;
        try {
            serialNumber = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException ex) {
            String message = "Page " + pageNumber + ": serial number '" + matcher.group(1) + "' of HRPN "
                    + matcher.group(2) + " is not a valid number; row skipped.";
            log.warn(message);
            diagnostics.add(message);
            return null;
        }

        int nameStart = anchorIndex;
        for (int i = regionStart; i < anchorIndex; i++) {
            String text = lines.get(i).trimmedText();
            if (LineRules.isNoise(text)) {
                continue;
            }
            if (LineRules.isNamePrefix(text) || firstOnPage) {
                nameStart = i;
                break;
            }
        }

        List<TextLine> blockLines = new ArrayList<>();
        for (int i = nameStart; i < anchorIndex; i++) {
            if (!LineRules.isNoise(lines.get(i).trimmedText())) {
                blockLines.add(lines.get(i));
            }
        }
        blockLines.add(anchor);
        for (int i = anchorIndex + 1; i < nextBoundary; i++) {
            String text = lines.get(i).trimmedText();
            if (LineRules.isTotal(text) || LineRules.isNamePrefix(text)) {
                break;
            }
            if (!LineRules.isNoise(text)) {
                blockLines.add(lines.get(i));
            }
        }

        log.debug("Block for HRPN {} on page {} spans {} lines", matcher.group(2), pageNumber, blockLines.size());
        return new EmployeeBlock(serialNumber, matcher.group(2), blockLines, anchor, pageNumber);
    }

    /**
     * Index of the first name or data line of a page; the first employee's name search starts there.
     */
    private int findHeaderEnd(List<TextLine> lines) {
        for (int i = 0; i < lines.size(); i++) {
            TextLine line = lines.get(i);
            if (LineRules.isNamePrefix(line.text()) || LineRules.isAnchor(line.text())) {
                return i;
            }
        }
        return 0;
    }

    /**
     * Output of segmentation for one document.
     */
    public record Segmentation(List<EmployeeBlock> blocks, TotalRow totalRow, List<String> diagnostics) {
        public Segmentation {
            blocks = blocks == null ? List.of() : List.copyOf(blocks);
            diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
        }
    }
}
