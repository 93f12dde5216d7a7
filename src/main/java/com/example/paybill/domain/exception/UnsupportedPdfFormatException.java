package com.example.paybill.domain.exception;

/**
 * Raised when an uploaded file does not look like a PDF by content type or file name.
 */
public class UnsupportedPdfFormatException extends DomainException {

    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF paybills are supported" + (fileName != null ? ": " + fileName : "."));
    }
}
