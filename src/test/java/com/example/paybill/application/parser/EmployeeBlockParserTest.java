package com.example.paybill.application.parser;

import com.example.paybill.domain.exception.MalformedEmployeeBlockException;
import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.EmployeeBlock;
import com.example.paybill.domain.model.ParsedEmployee;
import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.TextLine;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.example.paybill.support.PaybillFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EmployeeBlockParserTest {

    private final EmployeeBlockParser parser = new EmployeeBlockParser();

    @Test
    void earningFlagPairSeparatesNameFromValues() {
        EmployeeBlock block = block("00125678",
                "Dr. Asha",
                "1 00125678 Patel Specialist No A 30000 15000 5000 50000");

        ParsedEmployee employee = parser.parse(block, BillType.EARNING);

        assertThat(employee.employeeId()).isEqualTo("00125678");
        assertThat(employee.serialNumber()).isEqualTo(1);
        assertThat(employee.name()).isEqualTo("Dr. Asha Patel");
        assertThat(employee.designation()).isEqualTo("Specialist");
        assertThat(employee.values()).containsExactly(
                new BigDecimal("30000"), new BigDecimal("15000"), new BigDecimal("5000"), new BigDecimal("50000"));
    }

    @Test
    void deductionValuesStartAtFirstNumber() {
        EmployeeBlock block = block("00125678",
                "Dr. Asha Kumari Patel",
                "1 00125678 Specialist 4000 1000.50 5000 45000");

        ParsedEmployee employee = parser.parse(block, BillType.DEDUCTION);

        assertThat(employee.name()).isEqualTo("Dr. Asha Kumari Patel");
        assertThat(employee.designation()).isEqualTo("Specialist");
        assertThat(employee.values()).containsExactly(
                new BigDecimal("4000"), new BigDecimal("1000.50"), new BigDecimal("5000"), new BigDecimal("45000"));
    }

    @Test
    void numberAfterClassBelongsToTheDesignationText() {
        EmployeeBlock block = block("00444444",
                "Shri. Kanu",
                "3 00444444 Bhai Class 4 -120 300");

        ParsedEmployee employee = parser.parse(block, BillType.DEDUCTION);

        assertThat(employee.name()).isEqualTo("Shri. Kanu Bhai Class 4");
        assertThat(employee.values()).containsExactly(new BigDecimal("-120"), new BigDecimal("300"));
    }

    @Test
    void payScaleDigitsNeverBecomeValuesOrNameText() {
        EmployeeBlock block = block("00555555",
                "Dr. Nita Desai",
                "Insurance Medical Officer PB-3 (15600-39100)/5400",
                "4 00555555 No A 56100 2000 58100",
                "(Class-I)");

        ParsedEmployee employee = parser.parse(block, BillType.EARNING);

        assertThat(employee.name()).isEqualTo("Dr. Nita Desai");
        assertThat(employee.designation()).isEqualTo("Insurance Medical Officer (Class-I)");
        assertThat(employee.values()).containsExactly(
                new BigDecimal("56100"), new BigDecimal("2000"), new BigDecimal("58100"));
    }

    @Test
    void nameContinuationBelowTheDataLineIsAppended() {
        EmployeeBlock block = block("00666666",
                "Smt. Meena",
                "5 00666666 Junior Clerk 9000 9000",
                "Ben Shah");

        ParsedEmployee employee = parser.parse(block, BillType.DEDUCTION);

        assertThat(employee.name()).isEqualTo("Smt. Meena Ben Shah");
        assertThat(employee.designation()).isEqualTo("Junior Clerk");
    }

    @Test
    void blockWithoutValuesIsRejected() {
        EmployeeBlock block = block("00777777", "Mr. Empty", "6 00777777 Peon No B");

        MalformedEmployeeBlockException ex = assertThrows(MalformedEmployeeBlockException.class,
                () -> parser.parse(block, BillType.EARNING));

        assertThat(ex.getEmployeeId()).isEqualTo("00777777");
        assertThat(ex.getMessage()).contains("00777777");
    }

    @Test
    void customVocabularyIsUsed() {
        EmployeeBlockParser custom = new EmployeeBlockParser(new DesignationVocabulary(List.of("Dietician")));
        EmployeeBlock block = block("00888888", "Ms. Rina", "7 00888888 Dietician 12000");

        assertThat(custom.parse(block, BillType.DEDUCTION).designation()).isEqualTo("Dietician");
    }

    /**
     * Builds a block from line texts; the line starting with a serial number and identifier is the anchor.
     */
    private EmployeeBlock block(String employeeId, String... texts) {
        List<TextLine> lines = new ArrayList<>();
        TextLine anchor = null;
        int y = 800;
        for (String text : texts) {
            PositionedToken token = token(20, y, text);
            TextLine line = new TextLine(1, y, List.of(token), text);
            lines.add(line);
            if (anchor == null && LineRules.isAnchor(text)) {
                anchor = line;
            }
            y -= 10;
        }
        int serial = Integer.parseInt(anchor.text().split(" ")[0]);
        return new EmployeeBlock(serial, employeeId, lines, anchor, 1);
    }
}
