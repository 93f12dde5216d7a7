package com.example.paybill.application.parser;

import com.example.paybill.domain.exception.MalformedEmployeeBlockException;
import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.EmployeeBlock;
import com.example.paybill.domain.model.ParsedEmployee;
import com.example.paybill.domain.model.TextLine;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns an employee block into identifier, name, designation and the ordered numeric values of the data row.
 */
@Component
public class EmployeeBlockParser {

    private static final Pattern PARENTHESIZED = Pattern.compile("^\\(.*\\)$");
    private static final Pattern FLAG_LETTER = Pattern.compile("^[A-Z]$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final DesignationVocabulary vocabulary;

    public EmployeeBlockParser() {
        this(DesignationVocabulary.DEFAULT);
    }

    public EmployeeBlockParser(DesignationVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Parses one block.
     *
     * @param block    lines of the employee, including the anchor line
     * @param billType earning bills mark the end of the name with a "No/Yes" + letter flag pair
     * @return parsed employee with raw positional values
     * @throws MalformedEmployeeBlockException when the anchor prefix is unreadable or the row has no numbers
     */
    public ParsedEmployee parse(EmployeeBlock block, BillType billType) {
        TextLine anchor = block.anchor();
        if (anchor == null || !LineRules.isAnchor(anchor.text())) {
            throw new MalformedEmployeeBlockException(block.employeeId(),
                    "HRPN " + block.employeeId() + ": data line does not start with a serial number and an 8-digit identifier.");
        }

        List<String> namesBefore = new ArrayList<>();
        List<String> namesAfter = new ArrayList<>();
        String designation = "";
        boolean afterAnchor = false;

        for (TextLine line : block.lines()) {
            if (line.equals(anchor)) {
                afterAnchor = true;
                continue;
            }
            String text = line.trimmedText();
            if (PayScaleFilter.isPayScaleLine(text)) {
                continue;
            }
            String cleaned = PayScaleFilter.strip(text);
            if (cleaned.isEmpty()) {
                continue;
            }
            if (PARENTHESIZED.matcher(cleaned).matches()) {
                if (!designation.isEmpty()) {
                    designation = designation + " " + cleaned;
                }
                continue;
            }

            String namePart = cleaned;
            Optional<DesignationVocabulary.Match> match = vocabulary.find(cleaned);
            if (match.isPresent()) {
                if (designation.isEmpty()) {
                    designation = match.get().designation();
                }
                namePart = match.get().namePart().trim();
            }
            if (!namePart.isEmpty()) {
                (afterAnchor ? namesAfter : namesBefore).add(namePart);
            }
        }

        String afterPrefix = LineRules.ANCHOR_STRIP.matcher(anchor.text()).replaceFirst("");
        List<String> tokens = Arrays.asList(WHITESPACE.split(afterPrefix.trim()));
        int numericStart = billType == BillType.EARNING ? findEligibilityFlag(tokens) : -1;
        int textEnd = numericStart >= 0 ? numericStart - 2 : -1;
        if (numericStart < 0) {
            numericStart = findFirstValue(tokens);
            textEnd = numericStart;
        }

        List<BigDecimal> values = numericStart >= 0
                ? LineRules.extractNumbers(String.join(" ", tokens.subList(numericStart, tokens.size())))
                : List.of();
        if (values.isEmpty()) {
            throw new MalformedEmployeeBlockException(block.employeeId(),
                    "HRPN " + block.employeeId() + ": data line carries no numeric values.");
        }

        String dataLineText = String.join(" ", tokens.subList(0, Math.max(textEnd, 0)));
        String nameOnDataLine = dataLineText.trim();
        Optional<DesignationVocabulary.Match> dataMatch = vocabulary.find(dataLineText);
        if (dataMatch.isPresent()) {
            if (designation.isEmpty()) {
                designation = dataMatch.get().designation();
            }
            nameOnDataLine = dataMatch.get().namePart().trim();
        }

        List<String> nameParts = new ArrayList<>(namesBefore);
        if (!nameOnDataLine.isEmpty()) {
            nameParts.add(nameOnDataLine);
        }
        nameParts.addAll(namesAfter);
        String fullName = collapse(PayScaleFilter.strip(collapse(String.join(" ", nameParts))));

        return new ParsedEmployee(block.serialNumber(), block.employeeId(), fullName, designation, values);
    }

    /**
     * Earning rows print an eligibility flag pair ("No A", "Yes B") between the name and the amounts.
     *
     * @return index of the first value token after the pair, or -1
     */
    private int findEligibilityFlag(List<String> tokens) {
        for (int i = 0; i + 1 < tokens.size(); i++) {
            String token = tokens.get(i);
            if ((token.equals("No") || token.equals("Yes")) && FLAG_LETTER.matcher(tokens.get(i + 1)).matches()) {
                return i + 2;
            }
        }
        return -1;
    }

    /**
     * @return index of the first numeric token that is not part of a "Class 4" style designation, or -1
     */
    private int findFirstValue(List<String> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            if (LineRules.NUMERIC_TOKEN.matcher(tokens.get(i)).matches() && !followsClass(tokens, i)) {
                return i;
            }
        }
        return -1;
    }

    private boolean followsClass(List<String> tokens, int index) {
        return index > 0 && tokens.get(index - 1).toLowerCase(Locale.ROOT).equals("class");
    }

    private String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }
}
