package com.example.paybill.domain.exception;

/**
 * Raised when a batch is submitted without any paybill file.
 */
public class PdfFileRequiredException extends DomainException {

    public PdfFileRequiredException() {
        super("Please choose at least one paybill PDF to upload.");
    }
}
