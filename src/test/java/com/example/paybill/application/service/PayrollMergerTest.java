package com.example.paybill.application.service;

import com.example.paybill.domain.model.FieldCategory;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.PayrollRecord;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PayrollMergerTest {

    private final PayrollMerger merger = new PayrollMerger();

    @Test
    void earningAndDeductionHalvesJoinOnEmployeeId() {
        NormalizedRecord earning = record("00125678", "Dr. Asha Patel", "Specialist",
                "basic", "30000", "da", "15000", "hra", "5000", "gross", "50000");
        NormalizedRecord deduction = record("00125678", "Dr. Asha Patel", "Specialist",
                "incomeTax", "4000", "profTax", "1000", "totalDed", "5000", "netPay", "45000");

        List<PayrollRecord> merged = merger.merge(List.of(earning), List.of(deduction));

        assertThat(merged).singleElement().satisfies(record -> {
            assertThat(record.employeeId()).isEqualTo("00125678");
            assertThat(record.gross()).isEqualByComparingTo("50000");
            assertThat(record.totalDeductions()).isEqualByComparingTo("5000");
            assertThat(record.netPay()).isEqualByComparingTo("45000");
            assertThat(record.earning()).containsKeys("basic", "da", "hra", "gross");
            assertThat(record.deduction()).containsOnlyKeys("incomeTax", "profTax");
        });
    }

    @Test
    void longestNameAndDesignationWin() {
        NormalizedRecord earning = record("00125678", "Dr. Asha Patel", "Specialist", "gross", "50000");
        NormalizedRecord deduction = record("00125678", "Dr. Asha Kumari Patel", "", "netPay", "45000");

        PayrollRecord merged = merger.merge(List.of(earning), List.of(deduction)).get(0);

        assertThat(merged.name()).isEqualTo("Dr. Asha Kumari Patel");
        assertThat(merged.designation()).isEqualTo("Specialist");
    }

    @Test
    void employeesPresentOnOneSideOnlyAreKeptAndOutputIsSortedById() {
        NormalizedRecord earningOnly = record("00300000", "Mr. C", "", "gross", "1000");
        NormalizedRecord deductionOnly = record("00100000", "Mr. A", "", "netPay", "900");

        List<PayrollRecord> merged = merger.merge(List.of(earningOnly), List.of(deductionOnly));

        assertThat(merged).extracting(PayrollRecord::employeeId).containsExactly("00100000", "00300000");
        assertThat(merged.get(0).gross()).isEqualByComparingTo("0");
        assertThat(merged.get(1).netPay()).isEqualByComparingTo("0");
    }

    @Test
    void zeroGrossDoesNotOverwriteEarlierGross() {
        NormalizedRecord first = record("00125678", "Dr. Asha", "", "gross", "50000");
        NormalizedRecord second = record("00125678", "Dr. Asha", "", "gross", "0");

        PayrollRecord merged = merger.merge(List.of(first, second), List.of()).get(0);

        assertThat(merged.gross()).isEqualByComparingTo("50000");
    }

    @Test
    void combineUnionsRecordsOfTheSameKindAcrossDocuments() {
        NormalizedRecord pageOne = record("00125678", "Dr. Asha", "", "basic", "30000");
        NormalizedRecord other = record("00999999", "Mr. B", "", "basic", "100");
        NormalizedRecord secondDocument = record("00125678", "Dr. Asha Patel", "Specialist", "gross", "50000");

        List<NormalizedRecord> combined = merger.combine(List.of(List.of(pageOne, other), List.of(secondDocument)));

        assertThat(combined).extracting(NormalizedRecord::employeeId).containsExactly("00125678", "00999999");
        assertThat(combined.get(0).fields()).containsOnlyKeys("basic", "gross");
        assertThat(combined.get(0).name()).isEqualTo("Dr. Asha Patel");
        assertThat(combined.get(0).designation()).isEqualTo("Specialist");
    }

    private static NormalizedRecord record(String id, String name, String designation, String... keyValues) {
        Map<String, BigDecimal> fields = new LinkedHashMap<>();
        Map<String, FieldCategory> categories = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            fields.put(keyValues[i], new BigDecimal(keyValues[i + 1]));
            categories.put(keyValues[i], FieldCategory.UNKNOWN);
        }
        return new NormalizedRecord(id, name, designation, fields, categories, List.copyOf(fields.values()));
    }
}
