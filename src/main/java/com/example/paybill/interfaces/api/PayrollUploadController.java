package com.example.paybill.interfaces.api;

import com.example.paybill.application.service.PayrollProcessingService;
import com.example.paybill.domain.model.PayrollBatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * Interfaces-layer REST controller that accepts a batch of paybill PDFs and returns the merged payroll.
 */
@RestController
@RequestMapping("/api/payroll")
public class PayrollUploadController {

    private static final Logger log = LoggerFactory.getLogger(PayrollUploadController.class);

    private final PayrollProcessingService processingService;

    public PayrollUploadController(PayrollProcessingService processingService) {
        this.processingService = processingService;
    }

    /**
     * Processes earning and deduction bills uploaded together.
     *
     * @param files one or more paybill PDFs
     * @return merged payroll, validation report and batch metadata as JSON
     */
    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PayrollBatchResult> process(@RequestParam("files") List<MultipartFile> files) {
        PayrollBatchResult result = processingService.processFiles(files,
                (phase, detail) -> log.debug("[{}] {}", phase.displayName(), detail));
        return ResponseEntity.ok(result);
    }
}
