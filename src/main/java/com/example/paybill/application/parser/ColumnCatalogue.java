package com.example.paybill.application.parser;

import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.PositionedToken;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Fixed, ordered list of the columns a bill of each type may print, each with the rule that finds it
 * in the header zone. Numbers in parentheses are the treasury field codes printed under the labels.
 */
public final class ColumnCatalogue {

    /** Used when a presence-only trigger fires but no token carries the field code. */
    static final float FALLBACK_X = 500f;

    private static final Pattern SPECIAL = Pattern.compile("^Special$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ADDITIONAL = Pattern.compile("^Additional$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_PRIVATE = Pattern.compile("^Non\\s*Private$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRACTICE = Pattern.compile("Practice", Pattern.CASE_INSENSITIVE);
    private static final Pattern NPP_TRIGGER =
            Pattern.compile("Non\\s*Private|Practice\\s*Allow|\\(0128\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NPP_CODE = Pattern.compile("0128");
    private static final Pattern RECOVERY = Pattern.compile("^Recovery$", Pattern.CASE_INSENSITIVE);

    private static final List<Entry> EARNING = List.of(
            new Entry("Basic Pay", ColumnDetector.keyword("Basic")),
            new Entry("DA (0103)", ColumnDetector.keyword("DA", "0103")),
            new Entry("HRA (0110)", ColumnDetector.keyword("HRA", "0110")),
            new Entry("CLA (0111)", ColumnDetector.keyword("CLA", "0111")),
            new Entry("Med Allow", ColumnDetector.keyword("Med", "0107")),
            new Entry("Trans Allow", ColumnDetector.keyword("Trans", "0113")),
            new Entry("Special Additional Pay", ColumnCatalogue::detectSpecialAdditionalPay),
            new Entry("Non Private Practice Allow", ColumnCatalogue::detectNonPrivatePractice),
            new Entry("Washing Allow", ColumnDetector.keyword("Washing", "0132")),
            new Entry("Nursing Allow", ColumnDetector.keyword("Nursing", "0129")),
            new Entry("Uniform Allow", ColumnDetector.keyword("Uniform", "0131")),
            new Entry("Book Allow", ColumnDetector.keyword("Book", "0104")),
            new Entry("ESIS Allow", ColumnDetector.keyword("ESIS", "0127")),
            new Entry("Recovery of Pay", ColumnCatalogue::detectRecovery),
            new Entry("Gross Amt", ColumnDetector.keyword("Gross")),
            new Entry("SLO", ColumnDetector.keyword("^SLO$"))
    );

    private static final List<Entry> DEDUCTION = List.of(
            new Entry("Income Tax", ColumnDetector.keyword("Income", "9510")),
            new Entry("Prof Tax", ColumnDetector.keyword("Prof", "9570")),
            new Entry("R&B", ColumnDetector.keyword("R&B", "9550")),
            new Entry("GPF Reg Class 4", ColumnDetector.keyword("Class", "9531")),
            new Entry("GPF Reg", ColumnDetector.triggered("GPF\\s*Reg|9670", "GPF", "9670")),
            new Entry("NPS Reg", ColumnDetector.keyword("NPS", "9534")),
            new Entry("Govt Fund", ColumnDetector.triggered("Govt\\s*Fund|9581", "Fund", "9581")),
            new Entry("Govt Saving", ColumnDetector.triggered("Govt\\s*Saving|9582", "Saving", "9582")),
            new Entry("Total Ded", ColumnDetector.keyword("Total\\s*Ded")),
            new Entry("Net Pay", ColumnDetector.keyword("Net\\s*Pay"))
    );

    private ColumnCatalogue() {
    }

    public static List<Entry> forType(BillType billType) {
        return billType == BillType.EARNING ? EARNING : DEDUCTION;
    }

    private static Optional<Float> detectSpecialAdditionalPay(HeaderTokenPool pool) {
        Optional<PositionedToken> special = pool.find(SPECIAL);
        Optional<PositionedToken> additional = pool.find(ADDITIONAL);
        if (special.isPresent() && additional.isPresent()) {
            return Optional.of(Math.min(special.get().x(), additional.get().x()));
        }
        return ColumnDetector.keyword("Special").detect(pool);
    }

    private static Optional<Float> detectNonPrivatePractice(HeaderTokenPool pool) {
        Optional<PositionedToken> nonPrivate = pool.find(NON_PRIVATE);
        if (nonPrivate.isPresent()) {
            return Optional.of(nonPrivate.get().x());
        }
        Optional<PositionedToken> practice = pool.find(PRACTICE);
        if (practice.isPresent()) {
            return Optional.of(practice.get().x());
        }
        if (pool.textContains(NPP_TRIGGER)) {
            return Optional.of(pool.find(NPP_CODE).map(PositionedToken::x).orElse(FALLBACK_X));
        }
        return Optional.empty();
    }

    private static Optional<Float> detectRecovery(HeaderTokenPool pool) {
        Optional<PositionedToken> recovery = pool.find(RECOVERY);
        if (recovery.isPresent()) {
            return Optional.of(recovery.get().x());
        }
        return ColumnDetector.keyword("Recovery").detect(pool);
    }

    /**
     * One catalogue entry: the column label and how to find it.
     */
    public record Entry(String label, ColumnDetector detector) {
    }
}
