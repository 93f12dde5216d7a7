package com.example.paybill.support;

import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.SourceDocument;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Small earning and deduction bills for two employees, as tokens or as generated PDFs.
 * <p>
 * Employee 00125678 (Dr. Asha Patel, Specialist): gross 50000, deductions 5000, net pay 45000.
 * Employee 00111111 (Mr. Ravi Shah, Peon): gross 16000, deductions 700, net pay 15300.
 */
public final class PaybillFixtures {

    public static final float COLUMN_GAP = 90f;
    private static final float LEFT_MARGIN = 20f;

    private PaybillFixtures() {
    }

    public static PositionedToken token(float x, float y, String text) {
        return new PositionedToken(x, y, text, text.length() * 4f);
    }

    /**
     * Places each text on the same baseline, {@link #COLUMN_GAP} apart.
     */
    public static List<PositionedToken> line(float y, String... texts) {
        List<PositionedToken> tokens = new ArrayList<>();
        for (int i = 0; i < texts.length; i++) {
            tokens.add(token(LEFT_MARGIN + i * COLUMN_GAP, y, texts[i]));
        }
        return tokens;
    }

    public static List<PositionedToken> earningPage() {
        List<PositionedToken> page = new ArrayList<>();
        page.addAll(line(800, "PAYBILL Earning Side"));
        page.addAll(line(785, "Month of : January-2026"));
        page.addAll(line(770, "Bill No. : 42"));
        page.addAll(line(755, "Name of Office : ESIS Hospital Naroda"));
        page.addAll(line(740, "Phone no : 079-2345678"));
        page.addAll(line(725, "Basic", "DA", "HRA", "Gross"));
        page.addAll(line(700, "Dr. Asha"));
        page.addAll(line(690, "1 00125678 Patel Specialist No A 30000 15000 5000 50000"));
        page.addAll(line(670, "Mr. Ravi Shah"));
        page.addAll(line(660, "2 00111111 Peon No B 10000 5000 1000 16000"));
        page.addAll(line(640, "Total 40000 20000 6000 66000"));
        return page;
    }

    public static List<PositionedToken> deductionPage() {
        List<PositionedToken> page = new ArrayList<>();
        page.addAll(line(800, "PAYBILL Deduction Side"));
        page.addAll(line(785, "Month of : January-2026"));
        page.addAll(line(770, "Bill No. : 43"));
        page.addAll(line(755, "Name of Office : ESIS Hospital Naroda"));
        page.addAll(line(740, "Phone no : 079-2345678"));
        page.addAll(line(725, "Income Tax", "Prof Tax", "Total Ded", "Net Pay"));
        page.addAll(line(700, "Dr. Asha Kumari Patel"));
        page.addAll(line(690, "1 00125678 Specialist 4000 1000 5000 45000"));
        page.addAll(line(670, "Mr. Ravi Shah"));
        page.addAll(line(660, "2 00111111 Peon 500 200 700 15300"));
        page.addAll(line(640, "Total 4500 1200 5700 60300"));
        return page;
    }

    public static SourceDocument earningDocument() {
        return new SourceDocument("earning.pdf", List.of(earningPage()));
    }

    public static SourceDocument deductionDocument() {
        return new SourceDocument("deduction.pdf", List.of(deductionPage()));
    }

    /**
     * Renders one PDF page per token list, drawing every token at its own coordinates.
     */
    public static byte[] pdf(List<List<PositionedToken>> pages) throws IOException {
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (List<PositionedToken> tokens : pages) {
                PDPage page = new PDPage(PDRectangle.A4);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    for (PositionedToken token : tokens) {
                        content.beginText();
                        content.setFont(font, 8);
                        content.newLineAtOffset(token.x(), token.y());
                        content.showText(token.text());
                        content.endText();
                    }
                }
            }
            document.save(output);
            return output.toByteArray();
        }
    }
}
