package com.example.paybill.application.parser;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Locates one expected column in the header token pool.
 */
@FunctionalInterface
public interface ColumnDetector {

    /**
     * @param pool header tokens of page one
     * @return x-position of the column, or empty when the header does not show it
     */
    Optional<Float> detect(HeaderTokenPool pool);

    /**
     * Matches the primary keyword first and only then the numeric field code.
     */
    static ColumnDetector keyword(String primaryRegex, String codeRegex) {
        Pattern primary = Pattern.compile(primaryRegex, Pattern.CASE_INSENSITIVE);
        Pattern code = codeRegex == null ? null : Pattern.compile(codeRegex);
        return pool -> {
            Optional<Float> x = pool.find(primary).map(token -> token.x());
            if (x.isPresent() || code == null) {
                return x;
            }
            return pool.find(code).map(token -> token.x());
        };
    }

    static ColumnDetector keyword(String primaryRegex) {
        return keyword(primaryRegex, null);
    }

    /**
     * Fires only when the joined header text mentions the column, then positions it on the first
     * matching token, falling back to the code token.
     */
    static ColumnDetector triggered(String triggerRegex, String tokenRegex, String codeRegex) {
        Pattern trigger = Pattern.compile(triggerRegex, Pattern.CASE_INSENSITIVE);
        Pattern token = Pattern.compile(tokenRegex, Pattern.CASE_INSENSITIVE);
        Pattern code = Pattern.compile(codeRegex);
        return pool -> {
            if (!pool.textContains(trigger)) {
                return Optional.empty();
            }
            Optional<Float> x = pool.find(token).map(found -> found.x());
            return x.isPresent() ? x : pool.find(code).map(found -> found.x());
        };
    }
}
