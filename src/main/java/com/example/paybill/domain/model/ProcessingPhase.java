package com.example.paybill.domain.model;

/**
 * Named phase boundaries reported to a {@link ProgressListener}.
 */
public enum ProcessingPhase {
    EXTRACTION("Extracting"),
    CLASSIFICATION("Detecting"),
    SCHEMA_DETECTION("Headers"),
    SEGMENTATION("Segmenting"),
    PARSING("Parsing"),
    MERGING("Merging"),
    VALIDATION("Validating"),
    COMPLETE("Complete"),
    FAILED("Error");

    private final String displayName;

    ProcessingPhase(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
