package com.example.paybill.domain.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stable field keys consumed by storage and reporting, with the header label pattern each one is recognized by.
 * Declaration order is the matching priority: more specific labels come before the generic ones they contain
 * (for example {@link #GPF_CLASS_4} before {@link #GPF_REG}).
 */
public enum CanonicalField {
    BASIC("basic", FieldCategory.EARNING, "basic\\s*pay"),
    DA("da", FieldCategory.EARNING, "\\bda\\b"),
    HRA("hra", FieldCategory.EARNING, "\\bhra\\b"),
    CLA("cla", FieldCategory.EARNING, "\\bcla\\b"),
    MED_ALLOW("medAllow", FieldCategory.EARNING, "med\\s*allow"),
    TRANS_ALLOW("transAllow", FieldCategory.EARNING, "trans\\s*allow"),
    SPECIAL_PAY("specialPay", FieldCategory.EARNING, "special\\s*additional\\s*pay"),
    NPP_ALLOW("nppAllow", FieldCategory.EARNING, "non\\s*private\\s*practice\\s*allow"),
    WASHING_ALLOW("washingAllow", FieldCategory.EARNING, "washing\\s*allow"),
    NURSING_ALLOW("nursingAllow", FieldCategory.EARNING, "nursing\\s*allow"),
    UNIFORM_ALLOW("uniformAllow", FieldCategory.EARNING, "uniform\\s*allow"),
    BOOK_ALLOW("bookAllow", FieldCategory.EARNING, "book\\s*allow"),
    ESIS_ALLOW("esisAllow", FieldCategory.EARNING, "esis\\s*allow"),
    RECOVERY_OF_PAY("recoveryOfPay", FieldCategory.EARNING, "recovery\\s*of\\s*pay"),
    GROSS("gross", FieldCategory.EARNING, "gross\\s*amt"),
    SLO("slo", FieldCategory.EARNING, "\\bslo\\b"),
    INCOME_TAX("incomeTax", FieldCategory.DEDUCTION, "income\\s*tax"),
    PROF_TAX("profTax", FieldCategory.DEDUCTION, "prof\\s*tax"),
    RNB("rnb", FieldCategory.DEDUCTION, "r\\s*&\\s*b"),
    GPF_CLASS_4("gpfClass4", FieldCategory.DEDUCTION, "gpf\\s*reg\\s*class\\s*4"),
    GPF_REG("gpfReg", FieldCategory.DEDUCTION, "gpf\\s*reg\\b"),
    NPS_REG("npsReg", FieldCategory.DEDUCTION, "nps\\s*reg"),
    GOVT_FUND("govtFund", FieldCategory.DEDUCTION, "govt?\\s*fund"),
    GOVT_SAVING("govtSaving", FieldCategory.DEDUCTION, "govt?\\s*saving"),
    TOTAL_DED("totalDed", FieldCategory.DEDUCTION, "total\\s*ded"),
    NET_PAY("netPay", FieldCategory.DEDUCTION, "net\\s*pay");

    private final String key;
    private final FieldCategory category;
    private final Pattern labelPattern;

    CanonicalField(String key, FieldCategory category, String labelRegex) {
        this.key = key;
        this.category = category;
        this.labelPattern = Pattern.compile(labelRegex, Pattern.CASE_INSENSITIVE);
    }

    public String key() {
        return key;
    }

    public FieldCategory category() {
        return category;
    }

    public boolean matchesLabel(String label) {
        return label != null && labelPattern.matcher(label).find();
    }

    /**
     * Finds the first field, in priority order, whose pattern matches the raw header label.
     *
     * @param label raw column label
     * @return matching field or empty when the label is not part of the known set
     */
    public static Optional<CanonicalField> forLabel(String label) {
        for (CanonicalField field : values()) {
            if (field.matchesLabel(label)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
