package com.example.paybill.application.parser;

import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.ColumnSchema;
import com.example.paybill.domain.model.PositionedToken;
import com.example.paybill.domain.model.TextLine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the column order of a bill from the header zone of its first page.
 * <p>
 * The header zone starts below the contact-information line (the one mentioning a phone or mobile number)
 * and ends at the first data row or honorific-prefixed name line. Each catalogue column found there is
 * placed at the x-position of its header token; sorting by x yields the order in which the trailing
 * numbers of every data line are assigned.
 */
@Component
public class HeaderSchemaDetector {

    private static final Logger log = LoggerFactory.getLogger(HeaderSchemaDetector.class);

    /**
     * @param firstPageLines lines of page one, top first
     * @param billType       bill type selecting the column catalogue
     * @return sparse column schema; {@link ColumnSchema#invalid()} when the header zone is empty
     */
    public ColumnSchema detect(List<TextLine> firstPageLines, BillType billType) {
        HeaderTokenPool pool = collectHeaderTokens(firstPageLines);
        if (pool.isEmpty()) {
            log.warn("Header zone of the {} bill is empty; numeric values will stay unlabeled.", billType);
            return ColumnSchema.invalid();
        }

        List<ColumnSchema.Column> columns = new ArrayList<>();
        for (ColumnCatalogue.Entry entry : ColumnCatalogue.forType(billType)) {
            Optional<Float> x = entry.detector().detect(pool);
            if (x.isPresent()) {
                columns.add(new ColumnSchema.Column(entry.label(), x.get()));
            } else {
                log.debug("Column '{}' not present in header", entry.label());
            }
        }
        // List.sort is stable: columns at the same x keep catalogue order.
        columns.sort(Comparator.comparingDouble(ColumnSchema.Column::x));
        log.debug("Resolved {} columns: {}", columns.size(), columns);
        return new ColumnSchema(columns, !columns.isEmpty(), pool.rawText());
    }

    HeaderTokenPool collectHeaderTokens(List<TextLine> lines) {
        List<PositionedToken> tokens = new ArrayList<>();
        boolean inHeaderZone = false;
        for (TextLine line : lines == null ? List.<TextLine>of() : lines) {
            String text = line.text();
            if (LineRules.isContactLine(text)) {
                inHeaderZone = true;
                continue;
            }
            if (!inHeaderZone) {
                continue;
            }
            if (LineRules.startsLikeAnchor(text) || LineRules.isNamePrefix(text)) {
                break;
            }
            tokens.addAll(line.tokens());
        }
        return new HeaderTokenPool(tokens);
    }
}
