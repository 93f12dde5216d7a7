package com.example.paybill.application.service;

import com.example.paybill.application.exception.NoConsumableDocumentException;
import com.example.paybill.application.exception.PayrollProcessingCancelledException;
import com.example.paybill.config.PaybillConfig;
import com.example.paybill.domain.exception.DomainException;
import com.example.paybill.domain.exception.PdfFileRequiredException;
import com.example.paybill.domain.exception.PdfNotFoundException;
import com.example.paybill.domain.exception.PdfPathRequiredException;
import com.example.paybill.domain.exception.UnsupportedPdfFormatException;
import com.example.paybill.domain.model.BatchMetadata;
import com.example.paybill.domain.model.BillType;
import com.example.paybill.domain.model.DocumentFailure;
import com.example.paybill.domain.model.DocumentMeta;
import com.example.paybill.domain.model.DocumentResult;
import com.example.paybill.domain.model.DocumentSummary;
import com.example.paybill.domain.model.NormalizedRecord;
import com.example.paybill.domain.model.PayrollBatchResult;
import com.example.paybill.domain.model.PayrollRecord;
import com.example.paybill.domain.model.ProcessingPhase;
import com.example.paybill.domain.model.ProgressListener;
import com.example.paybill.domain.model.SourceDocument;
import com.example.paybill.domain.model.ValidationResult;
import com.example.paybill.infrastructure.exception.InfrastructureException;
import com.example.paybill.infrastructure.exception.PdfProcessingException;
import com.example.paybill.infrastructure.pdf.PdfBoxTokenExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Application-layer service that orchestrates a paybill batch.
 * <p>
 * Documents are loaded and parsed independently on the document executor. Merge and validation wait
 * for every document and see the results in input order. A document that fails is reported in the
 * batch metadata; only a batch where no document succeeds is rejected.
 */
@Service
public class PayrollProcessingService {

    private static final Logger log = LoggerFactory.getLogger(PayrollProcessingService.class);

    private final Executor documentExecutor;
    private final PdfBoxTokenExtractor tokenExtractor;
    private final PaybillDocumentParser documentParser;
    private final PayrollMerger merger;
    private final PayrollValidator validator;

    public PayrollProcessingService(@Qualifier(PaybillConfig.DOCUMENT_EXECUTOR) Executor documentExecutor,
                                    PdfBoxTokenExtractor tokenExtractor,
                                    PaybillDocumentParser documentParser,
                                    PayrollMerger merger,
                                    PayrollValidator validator) {
        this.documentExecutor = documentExecutor;
        this.tokenExtractor = tokenExtractor;
        this.documentParser = documentParser;
        this.merger = merger;
        this.validator = validator;
    }

    /**
     * Processes documents whose tokens were already extracted.
     *
     * @param documents source documents in input order
     * @param listener  optional progress callback
     * @return merged payroll, validation report and batch metadata
     * @throws NoConsumableDocumentException when no document could be parsed
     */
    public PayrollBatchResult process(List<SourceDocument> documents, ProgressListener listener) {
        List<PendingDocument> pending = new ArrayList<>();
        if (documents != null) {
            for (SourceDocument document : documents) {
                if (document != null) {
                    pending.add(new PendingDocument(document.fileName(), () -> document));
                }
            }
        }
        return run(pending, listener);
    }

    /**
     * Processes uploaded PDFs. A file that is empty or not a PDF is reported as a failed document.
     *
     * @param files    uploaded paybill PDFs
     * @param listener optional progress callback
     * @return merged payroll, validation report and batch metadata
     * @throws PdfFileRequiredException      when no file was uploaded
     * @throws NoConsumableDocumentException when no file could be parsed
     */
    public PayrollBatchResult processFiles(List<MultipartFile> files, ProgressListener listener) {
        if (files == null || files.stream().allMatch(file -> file == null || file.isEmpty())) {
            throw new PdfFileRequiredException();
        }
        List<PendingDocument> pending = new ArrayList<>();
        for (MultipartFile file : files) {
            if (file == null) {
                continue;
            }
            String fileName = resolveFileName(file);
            pending.add(new PendingDocument(fileName, () -> loadUpload(file, fileName)));
        }
        return run(pending, listener);
    }

    /**
     * Processes PDFs from the filesystem. A path that does not exist is reported as a failed document.
     *
     * @param paths    paybill PDF paths
     * @param listener optional progress callback
     * @return merged payroll, validation report and batch metadata
     * @throws PdfPathRequiredException      when the list is empty or contains {@code null}
     * @throws NoConsumableDocumentException when no file could be parsed
     */
    public PayrollBatchResult processPaths(List<Path> paths, ProgressListener listener) {
        if (paths == null || paths.isEmpty() || paths.stream().anyMatch(Objects::isNull)) {
            throw new PdfPathRequiredException();
        }
        List<PendingDocument> pending = new ArrayList<>();
        for (Path path : paths) {
            String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
            pending.add(new PendingDocument(fileName, () -> loadPath(path)));
        }
        return run(pending, listener);
    }

    private PayrollBatchResult run(List<PendingDocument> pending, ProgressListener listener) {
        ProgressListener progress = serialized(ProgressListener.orNone(listener));
        log.info("Processing paybill batch of {} documents", pending.size());

        List<CompletableFuture<DocumentOutcome>> futures = pending.stream()
                .map(document -> submit(document, progress))
                .toList();

        List<DocumentResult> results = new ArrayList<>();
        List<DocumentFailure> failures = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            DocumentOutcome outcome = await(futures, i, pending.get(i).fileName());
            if (outcome.result() != null) {
                results.add(outcome.result());
            } else {
                failures.add(outcome.failure());
            }
        }

        if (results.isEmpty()) {
            NoConsumableDocumentException ex = new NoConsumableDocumentException(failures);
            progress.onProgress(ProcessingPhase.FAILED, ex.getMessage());
            log.warn("Paybill batch rejected: {}", ex.getMessage());
            throw ex;
        }

        progress.onProgress(ProcessingPhase.MERGING, "Merging records from " + results.size() + " documents...");
        List<NormalizedRecord> earning = merger.combine(recordsOf(results, BillType.EARNING));
        List<NormalizedRecord> deduction = merger.combine(recordsOf(results, BillType.DEDUCTION));
        List<PayrollRecord> payroll = merger.merge(earning, deduction);

        progress.onProgress(ProcessingPhase.VALIDATION, "Validating " + payroll.size() + " records...");
        ValidationResult validation = validator.validate(payroll, results);

        BatchMetadata metadata = buildMetadata(results, failures, payroll.size());
        progress.onProgress(ProcessingPhase.COMPLETE, "Done: " + payroll.size() + " employees");
        log.info("Paybill batch done: {} employees from {} documents, {} failed documents",
                payroll.size(), results.size(), failures.size());
        return new PayrollBatchResult(payroll, validation, metadata);
    }

    private DocumentOutcome parseDocument(PendingDocument pending, ProgressListener progress) {
        try {
            progress.onProgress(ProcessingPhase.EXTRACTION, "Extracting text from " + pending.fileName() + "...");
            SourceDocument source = pending.loader().get();
            return DocumentOutcome.success(documentParser.parse(source, progress));
        } catch (DomainException | InfrastructureException ex) {
            log.warn("{}: document skipped: {}", pending.fileName(), ex.getMessage());
            return DocumentOutcome.failed(pending.fileName(), ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("{}: unexpected failure while parsing", pending.fileName(), ex);
            return DocumentOutcome.failed(pending.fileName(), "Unexpected error: " + ex.getMessage());
        }
    }

    private CompletableFuture<DocumentOutcome> submit(PendingDocument pending, ProgressListener progress) {
        try {
            return CompletableFuture.supplyAsync(() -> parseDocument(pending, progress), documentExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("{}: document executor rejected the task: {}", pending.fileName(), ex.getMessage());
            return CompletableFuture.completedFuture(
                    DocumentOutcome.failed(pending.fileName(), "Not processed: the document executor is saturated."));
        }
    }

    /**
     * Waits for one document. On interruption the documents that have not started yet are skipped;
     * documents already being parsed run to completion and their results are discarded.
     */
    private DocumentOutcome await(List<CompletableFuture<DocumentOutcome>> futures, int index, String fileName) {
        try {
            return futures.get(index).get();
        } catch (InterruptedException ex) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new PayrollProcessingCancelledException("Paybill processing was cancelled while waiting for " + fileName + ".", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("{}: document task failed", fileName, cause);
            return DocumentOutcome.failed(fileName, "Unexpected error: " + cause.getMessage());
        }
    }

    private List<List<NormalizedRecord>> recordsOf(List<DocumentResult> results, BillType billType) {
        return results.stream()
                .filter(result -> result.billType() == billType)
                .map(DocumentResult::records)
                .toList();
    }

    private BatchMetadata buildMetadata(List<DocumentResult> results, List<DocumentFailure> failures, int totalEmployees) {
        String month = firstPresent(results, DocumentMeta::month);
        return new BatchMetadata(
                Instant.now(),
                month,
                firstPresent(results, DocumentMeta::billNumber),
                firstPresent(results, DocumentMeta::office),
                DocumentMeta.parsePeriod(month),
                results.stream().map(DocumentSummary::of).toList(),
                failures,
                totalEmployees
        );
    }

    private String firstPresent(List<DocumentResult> results, Function<DocumentMeta, String> field) {
        return results.stream()
                .map(result -> field.apply(result.meta()))
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }

    private SourceDocument loadUpload(MultipartFile file, String fileName) {
        if (file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        try {
            return tokenExtractor.extract(file.getBytes(), fileName);
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to process the uploaded PDF file " + fileName + ".", e);
        }
    }

    private SourceDocument loadPath(Path path) {
        if (!Files.exists(path)) {
            throw new PdfNotFoundException(path.toAbsolutePath().toString());
        }
        return tokenExtractor.extract(path);
    }

    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String resolveFileName(MultipartFile file) {
        String fileName = file.getOriginalFilename();
        if (fileName == null || fileName.isBlank()) {
            return "uploaded.pdf";
        }
        return fileName;
    }

    /**
     * Wraps a listener so that callbacks from several document workers never overlap.
     */
    private static ProgressListener serialized(ProgressListener listener) {
        Object lock = new Object();
        return (phase, detail) -> {
            synchronized (lock) {
                listener.onProgress(phase, detail);
            }
        };
    }

    private record PendingDocument(String fileName, Supplier<SourceDocument> loader) {
    }

    private record DocumentOutcome(DocumentResult result, DocumentFailure failure) {
        static DocumentOutcome success(DocumentResult result) {
            return new DocumentOutcome(result, null);
        }

        static DocumentOutcome failed(String fileName, String reason) {
            return new DocumentOutcome(null, new DocumentFailure(fileName, reason));
        }
    }
}
