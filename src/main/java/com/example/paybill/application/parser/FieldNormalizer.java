package com.example.paybill.application.parser;

import com.example.paybill.domain.model.CanonicalField;
import com.example.paybill.domain.model.FieldCategory;
import com.example.paybill.domain.model.NormalizedHeader;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.ParsedEmployee;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps column labels to canonical field keys and labels the parsed values of each employee.
 */
@Component
public class FieldNormalizer {

    static final String UNKNOWN_KEY = "unknown";
    private static final Pattern PARENTHETICAL = Pattern.compile("\\([^)]*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Resolves a raw label against {@link CanonicalField} in priority order. Labels outside the known set
     * get a camel-cased key derived from their words, so no column is ever dropped.
     *
     * @param rawLabel label as it appears in the column schema
     * @return canonical key and category
     */
    public NormalizedHeader normalizeHeader(String rawLabel) {
        Optional<CanonicalField> known = CanonicalField.forLabel(rawLabel);
        if (known.isPresent()) {
            return new NormalizedHeader(rawLabel, known.get().key(), known.get().category());
        }
        return new NormalizedHeader(rawLabel, deriveKey(rawLabel), FieldCategory.UNKNOWN);
    }

    public List<NormalizedHeader> normalizeHeaders(List<String> rawLabels) {
        return rawLabels.stream().map(this::normalizeHeader).toList();
    }

    /**
     * Zips canonical keys with the employee's values by position. Columns without a value get zero;
     * values without a column are kept only in {@link NormalizedRecord#rawValues()}.
     */
    public NormalizedRecord normalize(ParsedEmployee employee, List<NormalizedHeader> headers) {
        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        Map<String, FieldCategory> categories = new LinkedHashMap<>();
        List<BigDecimal> values = employee.values();
        for (int i = 0; i < headers.size(); i++) {
            NormalizedHeader header = headers.get(i);
            fields.put(header.canonical(), i < values.size() ? values.get(i) : BigDecimal.ZERO);
            categories.put(header.canonical(), header.category());
        }
        return new NormalizedRecord(
                employee.employeeId(),
                employee.name(),
                employee.designation(),
                fields,
                categories,
                values
        );
    }

    private String deriveKey(String rawLabel) {
        String stripped = PARENTHETICAL.matcher(rawLabel == null ? "" : rawLabel).replaceAll("").trim();
        if (stripped.isEmpty()) {
            return UNKNOWN_KEY;
        }
        String[] words = WHITESPACE.split(stripped);
        StringBuilder key = new StringBuilder(words[0].toLowerCase(Locale.ROOT));
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            key.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return key.toString();
    }
}
