package com.example.paybill.application.service;

import com.example.paybill.application.parser.BillClassifier;
import com.example.paybill.application.parser.EmployeeBlockParser;
import com.example.paybill.application.parser.FieldNormalizer;
import com.example.paybill.application.parser.HeaderSchemaDetector;
import com.example.paybill.application.parser.LineReconstructor;
import com.example.paybill.application.parser.RowSegmenter;
import com.example.paybill.domain.exception.UnknownBillTypeException;
import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.DocumentResult;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.ProcessingPhase;
import com.example.paybill.domain.model.SourceDocument;
import com.example.paybill.support.PaybillFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static com.example.paybill.support.PaybillFixtures.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PaybillDocumentParserTest {

    static PaybillDocumentParser newParser() {
        return new PaybillDocumentParser(
                new LineReconstructor(),
                new BillClassifier(),
                new HeaderSchemaDetector(),
                new RowSegmenter(),
                new EmployeeBlockParser(),
                new FieldNormalizer());
    }

    private final PaybillDocumentParser parser = newParser();

    @Test
    void parsesEarningBill() {
        DocumentResult result = parser.parse(PaybillFixtures.earningDocument(), null);

        assertThat(result.billType()).isEqualTo(BillType.EARNING);
        assertThat(result.meta().billNumber()).isEqualTo("42");
        assertThat(result.pageCount()).isEqualTo(1);
        assertThat(result.records()).extracting(NormalizedRecord::employeeId).containsExactly("00125678", "00111111");

        NormalizedRecord asha = result.records().get(0);
        assertThat(asha.name()).isEqualTo("Dr. Asha Patel");
        assertThat(asha.fields()).containsOnlyKeys("basic", "da", "hra", "gross");
        assertThat(asha.fields().get("gross")).isEqualByComparingTo("50000");
        assertThat(result.totalRow().values()).hasSize(4);
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void reportsPhasesInOrder() {
        List<ProcessingPhase> phases = new ArrayList<>();

        parser.parse(PaybillFixtures.deductionDocument(), (phase, detail) -> phases.add(phase));

        assertThat(phases).containsExactly(
                ProcessingPhase.CLASSIFICATION,
                ProcessingPhase.SCHEMA_DETECTION,
                ProcessingPhase.SEGMENTATION,
                ProcessingPhase.PARSING);
    }

    @Test
    void droppedBlockBecomesADiagnostic() {
        List<PositionedToken> page = new ArrayList<>(PaybillFixtures.deductionPage());
        page.addAll(line(655, "Mr. No Values"));
        page.addAll(line(650, "3 00222222 Peon"));

        DocumentResult result = parser.parse(new SourceDocument("deduction.pdf", List.of(page)), null);

        assertThat(result.records()).extracting(NormalizedRecord::employeeId).containsExactly("00125678", "00111111");
        assertThat(result.diagnostics()).anyMatch(message -> message.contains("00222222"));
    }

    @Test
    void headerlessBillKeepsValuesUnlabeled() {
        List<PositionedToken> page = new ArrayList<>();
        page.addAll(line(800, "Deduction Side"));
        page.addAll(line(700, "Dr. Asha"));
        page.addAll(line(690, "1 00125678 Specialist 4000 1000"));

        DocumentResult result = parser.parse(new SourceDocument("bare.pdf", List.of(page)), null);

        assertThat(result.schema().valid()).isFalse();
        assertThat(result.records()).singleElement().satisfies(record -> {
            assertThat(record.fields()).isEmpty();
            assertThat(record.rawValues()).containsExactly(new BigDecimal("4000"), new BigDecimal("1000"));
        });
        assertThat(result.diagnostics()).isNotEmpty();
    }

    @Test
    void unknownBillTypeFailsTheDocument() {
        SourceDocument document = new SourceDocument("letter.pdf", List.of(line(700, "Dear Sir")));

        assertThrows(UnknownBillTypeException.class, () -> parser.parse(document, null));
    }
}
