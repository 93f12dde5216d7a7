package com.example.paybill.application.parser;

import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.ColumnSchema;
import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.TextLine;
import com.example.paybill.support.PaybillFixtures;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.example.paybill.support.PaybillFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;

class HeaderSchemaDetectorTest {

    private final LineReconstructor reconstructor = new LineReconstructor();
    private final HeaderSchemaDetector detector = new HeaderSchemaDetector();

    @Test
    void ordersEarningColumnsByHeaderPosition() {
        List<TextLine> lines = reconstructor.reconstructPage(1, PaybillFixtures.earningPage()).lines();

        ColumnSchema schema = detector.detect(lines, BillType.EARNING);

        assertThat(schema.valid()).isTrue();
        assertThat(schema.labels()).containsExactly("Basic Pay", "DA (0103)", "HRA (0110)", "Gross Amt");
        assertThat(schema.rawHeaderText()).isEqualTo("Basic DA HRA Gross");
    }

    @Test
    void resolvesDeductionColumns() {
        List<TextLine> lines = reconstructor.reconstructPage(1, PaybillFixtures.deductionPage()).lines();

        ColumnSchema schema = detector.detect(lines, BillType.DEDUCTION);

        assertThat(schema.labels()).containsExactly("Income Tax", "Prof Tax", "Total Ded", "Net Pay");
    }

    @Test
    void keywordTokenWinsOverFieldCode() {
        List<PositionedToken> page = new ArrayList<>();
        page.add(token(20, 760, "Phone 12345"));
        page.add(token(100, 740, "(0103)"));
        page.add(token(300, 740, "DA"));
        page.add(token(400, 740, "Gross"));
        page.add(token(20, 700, "Dr. Someone"));

        ColumnSchema schema = detector.detect(reconstructor.reconstructPage(1, page).lines(), BillType.EARNING);

        assertThat(schema.columns()).extracting(ColumnSchema.Column::label).containsExactly("DA (0103)", "Gross Amt");
        assertThat(schema.columns().get(0).x()).isEqualTo(300f);
    }

    @Test
    void fieldCodeLocatesColumnWhenKeywordIsMissing() {
        List<PositionedToken> page = new ArrayList<>();
        page.add(token(20, 760, "Mobile 98765"));
        page.add(token(150, 740, "(0110)"));
        page.add(token(50, 740, "Basic"));

        ColumnSchema schema = detector.detect(reconstructor.reconstructPage(1, page).lines(), BillType.EARNING);

        assertThat(schema.labels()).containsExactly("Basic Pay", "HRA (0110)");
    }

    @Test
    void headerZoneStopsAtFirstDataLine() {
        List<PositionedToken> page = new ArrayList<>();
        page.add(token(20, 760, "Phone 12345"));
        page.add(token(20, 740, "Basic"));
        page.add(token(20, 720, "1 00125678 Someone 100 200"));
        page.add(token(300, 700, "Gross"));

        ColumnSchema schema = detector.detect(reconstructor.reconstructPage(1, page).lines(), BillType.EARNING);

        assertThat(schema.labels()).containsExactly("Basic Pay");
    }

    @Test
    void missingContactLineGivesInvalidSchema() {
        List<PositionedToken> page = List.of(token(20, 740, "Basic"), token(100, 740, "Gross"));

        ColumnSchema schema = detector.detect(reconstructor.reconstructPage(1, page).lines(), BillType.EARNING);

        assertThat(schema.valid()).isFalse();
        assertThat(schema.columns()).isEmpty();
    }

    @Test
    void detectionIsIdempotent() {
        List<TextLine> lines = reconstructor.reconstructPage(1, PaybillFixtures.earningPage()).lines();

        assertThat(detector.detect(lines, BillType.EARNING)).isEqualTo(detector.detect(lines, BillType.EARNING));
    }
}
