package com.example.paybill.application.parser;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text rules shared by the header, segmentation and block parsing steps.
 */
final class LineRules {

    /** Serial number followed by an 8-digit employee identifier and at least one more token. */
    static final Pattern ANCHOR = Pattern.compile("^(\\d+)\\s+(\\d{8})\\s");
    /** Looser anchor check used to close the header zone. */
    static final Pattern ANCHOR_PREFIX = Pattern.compile("^\\d+\\s+\\d{8}");
    static final Pattern ANCHOR_STRIP = Pattern.compile("^\\d+\\s+\\d{8}\\s+");
    static final Pattern NUMBER = Pattern.compile("-?\\d+\\.?\\d*");
    static final Pattern NUMERIC_TOKEN = Pattern.compile("^-?\\d+\\.?\\d*$");

    private static final Pattern NAME_PREFIX =
            Pattern.compile("^(Mr\\.|Mrs\\.|Miss\\.|Ms\\.|Dr\\.|Shri\\.|Smt\\.)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TOTAL = Pattern.compile("^total\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONTACT = Pattern.compile("phone|mobile", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> NOISE = List.of(
            Pattern.compile("karmyogi|gujarat\\.gov", Pattern.CASE_INSENSITIVE),
            TOTAL,
            Pattern.compile("hereby certify|rupees\\s*(\\(|:)|superintendent|cardex\\s*no|date\\s*:", Pattern.CASE_INSENSITIVE),
            Pattern.compile("PAYBILL|INNER SHEET|D\\.D\\.O|Name\\s+of\\s+(Office|D\\.D\\.O|Ministry)|Phone\\s*no|Taluka"
                    + "|E-Mail|Address|Department|Major\\s+Head|TAN\\s+No|Bill\\s+No|Cardex\\s+No", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^ESIS\\s+General\\s+Hospital", Pattern.CASE_INSENSITIVE)
    );

    private LineRules() {
    }

    static boolean isAnchor(String text) {
        return text != null && ANCHOR.matcher(text).find();
    }

    static boolean startsLikeAnchor(String text) {
        return text != null && ANCHOR_PREFIX.matcher(text).find();
    }

    /**
     * @return {@code true} when the trimmed line starts with an honorific such as {@code Dr.} or {@code Smt.}
     */
    static boolean isNamePrefix(String text) {
        return text != null && NAME_PREFIX.matcher(text.trim()).find();
    }

    static boolean isTotal(String text) {
        return text != null && TOTAL.matcher(text.trim()).find();
    }

    static boolean isContactLine(String text) {
        return text != null && CONTACT.matcher(text).find();
    }

    /**
     * Institutional boilerplate, certification text, bill metadata and the total row never belong to an employee.
     * Note that {@code superintendent} is treated as noise, so a line holding only that title is skipped.
     */
    static boolean isNoise(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        for (Pattern pattern : NOISE) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Extracts every number-like substring (decimal, optionally negative) in order.
     */
    static List<BigDecimal> extractNumbers(String text) {
        List<BigDecimal> values = new ArrayList<>();
        if (text == null) {
            return values;
        }
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            values.add(new BigDecimal(matcher.group()));
        }
        return values;
    }
}
