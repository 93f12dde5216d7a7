package com.example.paybill.application.service;

import com.example.paybill.application.parser.BillClassifier;
import com.example.paybill.application.parser.EmployeeBlockParser;
import com.example.paybill.application.parser.FieldNormalizer;
import com.example.paybill.application.parser.HeaderSchemaDetector;
import com.example.paybill.application.parser.LineReconstructor;
import com.example.paybill.application.parser.RowSegmenter;
import com.example.paybill.domain.exception.MalformedEmployeeBlockException;
import com.example.paybill.domain.model.ColumnSchema;
import com.example.paybill.domain.model.DocumentMeta;
import com.example.paybill.domain.model.DocumentResult;
import com.example.paybill.domain.model.EmployeeBlock;
import com.example.paybill.domain.model.NormalizedHeader;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.ParsedEmployee;
import com.example.paybill.domain.model.ProcessingPhase;
import com.example.paybill.domain.model.ProgressListener;
import com.example.paybill.domain.model.ReconstructedDocument;
import com.example.paybill.domain.model.SourceDocument;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the per-document part of the pipeline: lines, bill type, column schema, employee blocks, parsed and
 * normalized records. Holds no state, so documents can be parsed concurrently.
 */
@Service
public class PaybillDocumentParser {

    private static final Logger log = LoggerFactory.getLogger(PaybillDocumentParser.class);

    private final LineReconstructor lineReconstructor;
    private final BillClassifier billClassifier;
    private final HeaderSchemaDetector schemaDetector;
    private final RowSegmenter rowSegmenter;
    private final EmployeeBlockParser blockParser;
    private final FieldNormalizer fieldNormalizer;

    public PaybillDocumentParser(LineReconstructor lineReconstructor,
                                 BillClassifier billClassifier,
                                 HeaderSchemaDetector schemaDetector,
                                 RowSegmenter rowSegmenter,
                                 EmployeeBlockParser blockParser,
                                 FieldNormalizer fieldNormalizer) {
        this.lineReconstructor = lineReconstructor;
        this.billClassifier = billClassifier;
        this.schemaDetector = schemaDetector;
        this.rowSegmenter = rowSegmenter;
        this.blockParser = blockParser;
        this.fieldNormalizer = fieldNormalizer;
    }

    /**
     * Parses a single paybill document.
     *
     * @param document tokens per page
     * @param listener progress callback
     * @return partial employee records of this document with its metadata and diagnostics
     * @throws com.example.paybill.domain.exception.UnknownBillTypeException when the bill type cannot be detected
     */
    public DocumentResult parse(SourceDocument document, ProgressListener listener) {
        ProgressListener progress = ProgressListener.orNone(listener);
        String fileName = document.fileName();
        ReconstructedDocument reconstructed = lineReconstructor.reconstruct(document);

        progress.onProgress(ProcessingPhase.CLASSIFICATION, "Detecting bill type for " + fileName + "...");
        DocumentMeta meta = billClassifier.classify(reconstructed.rawText());

        progress.onProgress(ProcessingPhase.SCHEMA_DETECTION,
                "Parsing headers (" + meta.billType().name().toLowerCase() + ") from " + fileName + "...");
        ColumnSchema schema = schemaDetector.detect(reconstructed.firstPageLines(), meta.billType());
        List<NormalizedHeader> headers = fieldNormalizer.normalizeHeaders(schema.labels());

        progress.onProgress(ProcessingPhase.SEGMENTATION, "Segmenting employee rows from " + fileName + "...");
        RowSegmenter.Segmentation segmentation = rowSegmenter.segment(reconstructed.pages());
        List<String> diagnostics = new ArrayList<>(segmentation.diagnostics());
        if (!schema.valid()) {
            diagnostics.add("No columns detected in the header; values are kept unlabeled.");
        }

        progress.onProgress(ProcessingPhase.PARSING,
                "Parsing " + segmentation.blocks().size() + " employee blocks from " + fileName + "...");
        List<NormalizedRecord> records = new ArrayList<>();
        for (EmployeeBlock block : segmentation.blocks()) {
            try {
                ParsedEmployee employee = blockParser.parse(block, meta.billType());
                records.add(fieldNormalizer.normalize(employee, headers));
            } catch (MalformedEmployeeBlockException ex) {
                log.warn("{}: dropping block of HRPN {} on page {}: {}",
                        fileName, ex.getEmployeeId(), block.pageNumber(), ex.getMessage());
                diagnostics.add("Page " + block.pageNumber() + ": " + ex.getMessage());
            }
        }

        log.info("{}: {} bill with {} columns and {} employee records", fileName, meta.billType(), schema.size(), records.size());
        return new DocumentResult(
                fileName,
                meta,
                schema,
                headers,
                records,
                segmentation.totalRow(),
                diagnostics,
                document.pageCount()
        );
    }
}
