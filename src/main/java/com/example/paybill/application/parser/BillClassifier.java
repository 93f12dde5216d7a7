package com.example.paybill.application.parser;

import com.example.paybill.domain.exception.UnknownBillTypeException;
import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.DocumentMeta;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a paybill is the earning side or the deduction side and reads the bill heading.
 */
@Component
public class BillClassifier {

    private static final Logger log = LoggerFactory.getLogger(BillClassifier.class);
    private static final String EARNING_MARKER = "earning side";
    private static final String DEDUCTION_MARKER = "deduction side";
    private static final Pattern MONTH_PATTERN =
            Pattern.compile("Month\\s+of\\s*:\\s*([A-Za-z]+-\\d{4})", Pattern.CASE_INSENSITIVE);
    private static final Pattern BILL_NUMBER_PATTERN =
            Pattern.compile("Bill\\s+No\\.\\s*:\\s*(\\S+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern OFFICE_PATTERN =
            Pattern.compile("Name\\s+of\\s+Office\\s*:\\s*(.+?)(?:\\s*Bill\\s+No|$)", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    /**
     * Classifies the document and extracts the optional heading fields.
     *
     * @param rawText newline-joined text of every line in the document
     * @return metadata with a mandatory bill type
     * @throws UnknownBillTypeException when neither side marker is present
     */
    public DocumentMeta classify(String rawText) {
        String text = rawText == null ? "" : rawText;
        String lower = text.toLowerCase(Locale.ROOT);
        boolean earning = lower.contains(EARNING_MARKER);
        boolean deduction = lower.contains(DEDUCTION_MARKER);
        if (!earning && !deduction) {
            throw new UnknownBillTypeException();
        }
        if (earning && deduction) {
            log.warn("Document carries both side markers; treating it as an earning bill.");
        }
        BillType billType = earning ? BillType.EARNING : BillType.DEDUCTION;

        return new DocumentMeta(
                billType,
                firstGroup(MONTH_PATTERN, text),
                firstGroup(BILL_NUMBER_PATTERN, text),
                firstGroup(OFFICE_PATTERN, text)
        );
    }

    private String firstGroup(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        String value = matcher.group(1).trim();
        return value.isEmpty() ? null : value;
    }
}
