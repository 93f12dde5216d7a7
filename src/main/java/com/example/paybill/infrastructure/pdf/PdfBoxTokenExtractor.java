package com.example.paybill.infrastructure.pdf;

import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.SourceDocument;
import com.example.paybill.infrastructure.exception.PdfProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure adapter that turns PDF bytes into positioned text runs ({@link PositionedToken}) per page using PDFBox.
 * Nothing above this class touches PDFBox types.
 */
@Component
public class PdfBoxTokenExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTokenExtractor.class);

    /**
     * Loads the PDF and collects its tokens.
     *
     * @param bytes    PDF bytes already loaded into memory
     * @param fileName logical name carried into the batch result
     * @return tokens of every page, in page order
     * @throws PdfProcessingException when PDFBox cannot read the bytes
     */
    public SourceDocument extract(byte[] bytes, String fileName) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            TokenStripper stripper = new TokenStripper(document.getNumberOfPages());
            stripper.getText(document);
            SourceDocument source = new SourceDocument(fileName, stripper.getPages());
            log.debug("{}: extracted tokens from {} pages", fileName, source.pageCount());
            return source;
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the PDF " + fileName + ".", e);
        }
    }

    /**
     * Reads a PDF from the filesystem. The caller checks that the path exists.
     *
     * @param pdfPath path pointing to a PDF file on disk
     * @return tokens of every page
     * @throws PdfProcessingException when the file cannot be read
     */
    public SourceDocument extract(Path pdfPath) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(pdfPath);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the PDF at " + pdfPath, e);
        }
        String fileName = pdfPath.getFileName() != null ? pdfPath.getFileName().toString() : "document.pdf";
        return extract(bytes, fileName);
    }

    /**
     * Captures each text run PDFBox writes together with its position instead of building a text string.
     * Runs are split where PDFBox detects a gap wider than a space; y is converted to bottom-up page coordinates.
     */
    private static final class TokenStripper extends PDFTextStripper {
        private final List<List<PositionedToken>> pages = new ArrayList<>();

        TokenStripper(int pageCount) throws IOException {
            for (int i = 0; i < pageCount; i++) {
                pages.add(new ArrayList<>());
            }
            setSortByPosition(true);
        }

        List<List<PositionedToken>> getPages() {
            return pages;
        }

        @Override
        protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
            if (!textPositions.isEmpty() && text != null && !text.isBlank()) {
                float x = textPositions.stream()
                        .map(TextPosition::getXDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                float width = textPositions.stream()
                        .map(TextPosition::getWidthDirAdj)
                        .reduce(0f, Float::sum);
                float baseline = textPositions.get(0).getYDirAdj();
                float pageHeight = getCurrentPage().getCropBox().getHeight();
                int pageIndex = getCurrentPageNo() - 1;
                if (pageIndex >= 0 && pageIndex < pages.size()) {
                    pages.get(pageIndex).add(new PositionedToken(x, pageHeight - baseline, text.trim(), width));
                }
            }
            super.writeString(text, textPositions);
        }
    }
}
