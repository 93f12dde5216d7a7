package com.example.paybill.domain.model;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bill heading metadata. Only the bill type is mandatory; the other fields are left {@code null}
 * when the heading does not carry them.
 */
public record DocumentMeta(
        BillType billType,
        String month,
        String billNumber,
        String office
) {
    private static final Logger log = LoggerFactory.getLogger(DocumentMeta.class);
    private static final DateTimeFormatter MONTH_LABEL_FORMATTER = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("MMMM-yyyy")
            .toFormatter(Locale.ENGLISH);

    public DocumentMeta {
        Objects.requireNonNull(billType, "billType");
    }

    /**
     * Parses the month label ({@code January-2026}) into a {@link YearMonth}.
     *
     * @return the pay period or {@code null} when the label is missing or not a month name
     */
    public YearMonth period() {
        return parsePeriod(month);
    }

    public static YearMonth parsePeriod(String monthLabel) {
        if (monthLabel == null || monthLabel.isBlank()) {
            return null;
        }
        try {
            return YearMonth.parse(monthLabel.trim(), MONTH_LABEL_FORMATTER);
        } catch (DateTimeParseException ex) {
            log.debug("Month label '{}' is not a recognizable period", monthLabel);
            return null;
        }
    }
}
