package com.example.paybill.application.service;

import com.example.paybill.domain.model.CanonicalField;
import com.example.paybill.domain.model.FieldCategory;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.PayrollRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consolidates partial employee records into one {@link PayrollRecord} per employee identifier.
 * The identifier is the only join key; names and designations are best effort and the longest wins.
 */
@Service
public class PayrollMerger {

    private static final Logger log = LoggerFactory.getLogger(PayrollMerger.class);

    /**
     * Combines the record sets of several documents of the same bill type. The first occurrence keeps its
     * position; later occurrences add or override fields and may lengthen name and designation.
     *
     * @param recordSets one list per document, in input order
     * @return deduplicated records
     */
    public List<NormalizedRecord> combine(List<List<NormalizedRecord>> recordSets) {
        Map<String, NormalizedRecord> combined = new LinkedHashMap<>();
        for (List<NormalizedRecord> records : recordSets) {
            for (NormalizedRecord record : records) {
                combined.merge(record.employeeId(), record, this::combinePair);
            }
        }
        return new ArrayList<>(combined.values());
    }

    /**
     * Builds one payroll record per distinct identifier across both bill types.
     *
     * @param earningRecords   combined earning-side records
     * @param deductionRecords combined deduction-side records
     * @return merged records sorted by identifier
     */
    public List<PayrollRecord> merge(List<NormalizedRecord> earningRecords, List<NormalizedRecord> deductionRecords) {
        Map<String, Accumulator> payroll = new LinkedHashMap<>();

        for (NormalizedRecord record : earningRecords) {
            Accumulator entry = payroll.computeIfAbsent(record.employeeId(), Accumulator::new);
            entry.absorbIdentity(record);
            entry.earning.putAll(record.fields());
            BigDecimal gross = record.fields().get(CanonicalField.GROSS.key());
            if (gross != null && gross.signum() != 0) {
                entry.gross = gross;
            }
        }

        for (NormalizedRecord record : deductionRecords) {
            Accumulator entry = payroll.computeIfAbsent(record.employeeId(), Accumulator::new);
            entry.absorbIdentity(record);
            Map<String, BigDecimal> fields = new LinkedHashMap<>(record.fields());
            BigDecimal totalDeductions = fields.remove(CanonicalField.TOTAL_DED.key());
            if (totalDeductions != null) {
                entry.totalDeductions = totalDeductions;
            }
            BigDecimal netPay = fields.remove(CanonicalField.NET_PAY.key());
            if (netPay != null) {
                entry.netPay = netPay;
            }
            entry.deduction.putAll(fields);
        }

        List<PayrollRecord> merged = payroll.values().stream()
                .map(Accumulator::toRecord)
                .sorted(Comparator.comparing(PayrollRecord::employeeId))
                .toList();
        log.info("Merged {} earning and {} deduction records into {} employees",
                earningRecords.size(), deductionRecords.size(), merged.size());
        return merged;
    }

    private NormalizedRecord combinePair(NormalizedRecord existing, NormalizedRecord incoming) {
        Map<String, BigDecimal> fields = new LinkedHashMap<>(existing.fields());
        fields.putAll(incoming.fields());
        Map<String, FieldCategory> categories = new LinkedHashMap<>(existing.categories());
        categories.putAll(incoming.categories());
        return new NormalizedRecord(
                existing.employeeId(),
                longer(existing.name(), incoming.name()),
                longer(existing.designation(), incoming.designation()),
                fields,
                categories,
                existing.rawValues()
        );
    }

    private static String longer(String current, String candidate) {
        return candidate != null && candidate.length() > current.length() ? candidate : current;
    }

    /**
     * Mutable per-identifier state; owned by a single merge call.
     */
    private static final class Accumulator {
        private final String employeeId;
        private String name = "";
        private String designation = "";
        private final Map<String, BigDecimal> earning = new LinkedHashMap<>();
        private final Map<String, BigDecimal> deduction = new LinkedHashMap<>();
        private BigDecimal gross = BigDecimal.ZERO;
        private BigDecimal totalDeductions = BigDecimal.ZERO;
        private BigDecimal netPay = BigDecimal.ZERO;

        Accumulator(String employeeId) {
            this.employeeId = employeeId;
        }

        void absorbIdentity(NormalizedRecord record) {
            name = longer(name, record.name());
            designation = longer(designation, record.designation());
        }

        PayrollRecord toRecord() {
            return new PayrollRecord(employeeId, name, designation, earning, deduction, gross, totalDeductions, netPay);
        }
    }
}
