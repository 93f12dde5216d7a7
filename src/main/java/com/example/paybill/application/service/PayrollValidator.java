package com.example.paybill.application.service;

import com.example.paybill.config.PaybillProperties;
import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.CanonicalField;
import com.example.paybill.domain.model.DocumentResult;
import com.example.paybill.domain.model.NormalizedHeader;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.PayrollRecord;
import com.example.paybill.domain.model.ValidationResult;
import com.example.paybill.domain.model.ValidationSummary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Cross-checks merged payroll records. Nothing here throws: every problem becomes an error or warning string.
 */
@Service
public class PayrollValidator {

    private static final Logger log = LoggerFactory.getLogger(PayrollValidator.class);
    private static final Pattern EMPLOYEE_ID = Pattern.compile("^\\d{8}$");
    private static final Set<String> EXCLUDED_FROM_EARNING_SUM = Set.of(
            CanonicalField.GROSS.key(),
            CanonicalField.SLO.key()
    );

    private final BigDecimal tolerance;

    public PayrollValidator(PaybillProperties properties) {
        this.tolerance = properties.amountTolerance();
    }

    public ValidationResult validate(List<PayrollRecord> records) {
        return validate(records, List.of());
    }

    /**
     * Validates merged records and, where a document printed a usable total row, its column totals.
     *
     * @param records   merged records
     * @param documents per-document results the records were merged from
     * @return errors, warnings and batch totals
     */
    public ValidationResult validate(List<PayrollRecord> records, List<DocumentResult> documents) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        int validRecords = 0;

        BigDecimal totalGross = BigDecimal.ZERO;
        BigDecimal totalDeductions = BigDecimal.ZERO;
        BigDecimal totalNetPay = BigDecimal.ZERO;
        Set<String> earningKeys = new TreeSet<>();
        Set<String> deductionKeys = new TreeSet<>();

        for (PayrollRecord record : records) {
            int errorsBefore = errors.size();
            String id = record.employeeId();

            if (!record.earning().isEmpty() && record.gross().signum() > 0) {
                BigDecimal earningSum = record.earning().entrySet().stream()
                        .filter(entry -> !EXCLUDED_FROM_EARNING_SUM.contains(entry.getKey()))
                        .map(Map.Entry::getValue)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                if (exceedsTolerance(earningSum, record.gross())) {
                    warnings.add(String.format("HRPN %s: earning sum (%s) does not match gross (%s)",
                            id, format(earningSum), format(record.gross())));
                }
            }

            if (record.gross().signum() > 0 && record.totalDeductions().signum() > 0 && record.netPay().signum() > 0) {
                BigDecimal computedNet = record.gross().subtract(record.totalDeductions());
                if (exceedsTolerance(computedNet, record.netPay())) {
                    errors.add(String.format("HRPN %s: gross - deductions = %s does not match net pay %s",
                            id, format(computedNet), format(record.netPay())));
                }
            }

            if (id == null || !EMPLOYEE_ID.matcher(id).matches()) {
                errors.add(String.format("Invalid HRPN: \"%s\"", id));
            }

            if (errors.size() == errorsBefore) {
                validRecords++;
            }
            totalGross = totalGross.add(record.gross());
            totalDeductions = totalDeductions.add(record.totalDeductions());
            totalNetPay = totalNetPay.add(record.netPay());
            earningKeys.addAll(record.earning().keySet());
            deductionKeys.addAll(record.deduction().keySet());
        }

        for (DocumentResult document : documents) {
            checkTotalRow(document).ifPresent(warnings::add);
        }

        ValidationSummary summary = new ValidationSummary(
                records.size(),
                totalGross,
                totalDeductions,
                totalNetPay,
                List.copyOf(earningKeys),
                List.copyOf(deductionKeys)
        );
        if (!errors.isEmpty()) {
            log.warn("Validation found {} errors and {} warnings over {} records", errors.size(), warnings.size(), records.size());
        } else {
            log.info("Validation passed for {} records with {} warnings", records.size(), warnings.size());
        }
        return new ValidationResult(errors.isEmpty(), records.size(), validRecords, errors, warnings, summary);
    }

    /**
     * Compares the printed total of the document's key column with the sum of its records.
     * Only applies when the total row has exactly one value per column.
     */
    private Optional<String> checkTotalRow(DocumentResult document) {
        if (document.totalRow() == null || document.headers().isEmpty()
                || document.totalRow().values().size() != document.headers().size()) {
            return Optional.empty();
        }
        String key = document.billType() == BillType.EARNING ? CanonicalField.GROSS.key() : CanonicalField.NET_PAY.key();
        List<NormalizedHeader> headers = document.headers();
        for (int i = 0; i < headers.size(); i++) {
            if (!headers.get(i).canonical().equals(key)) {
                continue;
            }
            BigDecimal printed = document.totalRow().values().get(i);
            BigDecimal summed = document.records().stream()
                    .map(NormalizedRecord::fields)
                    .map(fields -> fields.getOrDefault(key, BigDecimal.ZERO))
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            if (exceedsTolerance(printed, summed)) {
                return Optional.of(String.format("%s: total row %s (%s) does not match the sum of its records (%s)",
                        document.fileName(), key, format(printed), format(summed)));
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    private boolean exceedsTolerance(BigDecimal left, BigDecimal right) {
        return left.subtract(right).abs().compareTo(tolerance) > 0;
    }

    private static String format(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
