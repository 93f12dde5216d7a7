package com.example.paybill.domain.exception;

/**
 * Raised when a caller passes a null {@link java.nio.file.Path} in a batch of paybill files.
 */
public class PdfPathRequiredException extends DomainException {

    public PdfPathRequiredException() {
        super("Paybill PDF path is required.");
    }
}
