package com.example.paybill.infrastructure.exception;

/**
 * Signals that a paybill PDF could not be read from disk or decoded by PDFBox.
 */
public class PdfProcessingException extends InfrastructureException {

	/**
	 * @param message description shared with the application layer
	 * @param cause   low-level IO or PDFBox exception
	 */
    public PdfProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
