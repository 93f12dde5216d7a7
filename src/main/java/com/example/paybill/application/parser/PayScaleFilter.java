package com.example.paybill.application.parser;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes and strips pay-band annotations such as {@code PB-3 (15600-39100)/5400}.
 * Their digits are never salary figures.
 */
final class PayScaleFilter {

    private static final Pattern PAY_SCALE_LINE = Pattern.compile(
            "^(PB-\\d|\\d{4,5}\\)/|\\d{4,5}-\\d|37400-|20200\\)|34800\\)|39100\\)|67000|4440-)",
            Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> PAY_SCALE_FRAGMENTS = List.of(
            Pattern.compile("\\s*PB-\\d\\s*\\([^)]*-?$", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*PB-\\d\\s*\\([^)]*\\)/\\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s*\\d{4,5}\\)/\\d+"),
            Pattern.compile("\\s*\\d{5}-\\d{5}/\\d+"),
            Pattern.compile("\\s*\\d{4}-\\d{4}/\\d{4}"),
            Pattern.compile("\\s*\\d{4}/\\d{4}"),
            Pattern.compile("\\s*4440-\\s*")
    );

    private PayScaleFilter() {
    }

    /**
     * @return {@code true} when the whole line is a pay-scale continuation
     */
    static boolean isPayScaleLine(String text) {
        return text != null && PAY_SCALE_LINE.matcher(text.trim()).find();
    }

    /**
     * Removes every pay-scale fragment from the text, keeping the name or designation around it.
     */
    static String strip(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text;
        for (Pattern fragment : PAY_SCALE_FRAGMENTS) {
            cleaned = fragment.matcher(cleaned).replaceAll("");
        }
        return cleaned.trim();
    }
}
